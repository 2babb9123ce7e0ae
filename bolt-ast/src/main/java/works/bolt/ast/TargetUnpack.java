package works.bolt.ast;

import works.bolt.host.AstChildren;

import static works.bolt.host.Attributes.required;

/**
 * Destructuring, as in {@code a, (b, c) = ...}.
 */
public record TargetUnpack(
	AstChildren<Target> targets
) implements Target {
	public TargetUnpack {
		required(TargetUnpack.class, "targets", targets);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitTargetUnpack(this);
	}
}
