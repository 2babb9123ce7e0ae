package works.bolt.ast;

import lombok.With;

import static works.bolt.host.Attributes.required;

/**
 * {@code value.name}
 */
@With
public record AttributeExpression(
	String name,
	Expression value
) implements Expression {
	public AttributeExpression {
		required(AttributeExpression.class, "name", name);
		required(AttributeExpression.class, "value", value);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitAttributeExpression(this);
	}
}
