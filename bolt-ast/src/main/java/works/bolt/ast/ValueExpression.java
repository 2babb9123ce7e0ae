package works.bolt.ast;

import static works.bolt.host.Attributes.required;

/**
 * A literal whose value the parser has already resolved.
 * <p>
 * The payload should itself be immutable, like a {@link String}, a boxed number, or a {@link Boolean},
 * since the node can't protect it.
 *
 * @param value the literal; use {@link None#NONE} for the script's {@code None},
 *              because a null payload means the attribute is missing
 */
public record ValueExpression(
	Object value
) implements Expression {
	public ValueExpression {
		required(ValueExpression.class, "value", value);
	}

	public enum None {
		NONE;

		@Override
		public String toString() {
			return "None";
		}
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitValueExpression(this);
	}
}
