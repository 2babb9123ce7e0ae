package works.bolt.ast;

import lombok.With;
import works.bolt.host.AstChildren;

import static works.bolt.host.Attributes.required;

/**
 * {@code value[arguments] = ...}
 */
@With
public record TargetItem(
	Expression value,
	AstChildren<Subscript> arguments
) implements Target {
	public TargetItem {
		required(TargetItem.class, "value", value);
		required(TargetItem.class, "arguments", arguments);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitTargetItem(this);
	}
}
