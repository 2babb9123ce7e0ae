package works.bolt.ast;

import static works.bolt.host.Attributes.required;

/**
 * A reference to a variable.
 */
public record IdentifierExpression(
	String value
) implements Expression {
	public IdentifierExpression {
		required(IdentifierExpression.class, "value", value);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitIdentifierExpression(this);
	}
}
