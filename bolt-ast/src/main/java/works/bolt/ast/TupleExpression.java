package works.bolt.ast;

import works.bolt.host.AstChildren;

import static works.bolt.host.Attributes.required;

public record TupleExpression(
	AstChildren<Expression> items
) implements Expression {
	public TupleExpression {
		required(TupleExpression.class, "items", items);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitTupleExpression(this);
	}
}
