package works.bolt.ast;

import works.bolt.host.AstChildren;

import static works.bolt.host.Attributes.required;

public record ListExpression(
	AstChildren<Expression> items
) implements Expression {
	public ListExpression {
		required(ListExpression.class, "items", items);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitListExpression(this);
	}
}
