package works.bolt.ast;

import lombok.With;

import static works.bolt.host.Attributes.required;

/**
 * {@code value.name = ...}
 *
 * @param value the object whose attribute is assigned; evaluated, not bound
 */
@With
public record TargetAttribute(
	String name,
	Expression value
) implements Target {
	public TargetAttribute {
		required(TargetAttribute.class, "name", name);
		required(TargetAttribute.class, "value", value);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitTargetAttribute(this);
	}
}
