package works.bolt.ast;

import lombok.With;
import works.bolt.host.AstChildren;

import static works.bolt.host.Attributes.required;

/**
 * An f-string.
 * <p>
 * The number of placeholders in {@code fmt} is not checked against the number of {@code values};
 * that's for the parser and compiler to report against the source.
 *
 * @param fmt the template, with positional placeholders
 * @param values filled into the placeholders in order
 */
@With
public record FormatStringExpression(
	String fmt,
	AstChildren<Expression> values
) implements Expression {
	public FormatStringExpression {
		required(FormatStringExpression.class, "fmt", fmt);
		required(FormatStringExpression.class, "values", values);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitFormatStringExpression(this);
	}
}
