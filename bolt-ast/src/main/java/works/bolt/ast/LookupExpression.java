package works.bolt.ast;

import lombok.With;
import works.bolt.host.AstChildren;

import static works.bolt.host.Attributes.required;

/**
 * {@code value[arguments]}. More than one argument means a multi-dimensional subscript,
 * like {@code grid[1:3, 0]}.
 */
@With
public record LookupExpression(
	Expression value,
	AstChildren<Subscript> arguments
) implements Expression {
	public LookupExpression {
		required(LookupExpression.class, "value", value);
		required(LookupExpression.class, "arguments", arguments);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitLookupExpression(this);
	}
}
