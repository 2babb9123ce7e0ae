package works.bolt.ast;

import lombok.With;

import static works.bolt.host.Attributes.required;

/**
 * @param operator the operator token as written, like {@code "+"} or {@code "not in"};
 *                 not interpreted here
 */
@With
public record BinaryExpression(
	String operator,
	Expression left,
	Expression right
) implements Expression {
	public BinaryExpression {
		required(BinaryExpression.class, "operator", operator);
		required(BinaryExpression.class, "left", left);
		required(BinaryExpression.class, "right", right);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitBinaryExpression(this);
	}
}
