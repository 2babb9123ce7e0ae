package works.bolt.ast;

import lombok.With;

import static works.bolt.host.Attributes.required;

@With
public record UnaryExpression(
	String operator,
	Expression value
) implements Expression {
	public UnaryExpression {
		required(UnaryExpression.class, "operator", operator);
		required(UnaryExpression.class, "value", value);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitUnaryExpression(this);
	}
}
