package works.bolt.ast;

import lombok.With;
import works.bolt.host.AstChildren;

import static works.bolt.host.Attributes.required;

/**
 * @param arguments in call order, mixing positional, unpacked, and keyword arguments as written
 */
@With
public record CallExpression(
	Expression value,
	AstChildren<CallArgument> arguments
) implements Expression {
	public CallExpression {
		required(CallExpression.class, "value", value);
		required(CallExpression.class, "arguments", arguments);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitCallExpression(this);
	}
}
