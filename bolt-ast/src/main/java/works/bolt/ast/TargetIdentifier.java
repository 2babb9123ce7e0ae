package works.bolt.ast;

import lombok.With;

import static works.bolt.host.Attributes.required;

/**
 * @param rebind false to introduce a new local binding;
 *               true to assign to an existing binding in an enclosing scope.
 *               The parser decides which from the surrounding syntax.
 */
@With
public record TargetIdentifier(
	String value,
	boolean rebind
) implements Target {
	public TargetIdentifier {
		required(TargetIdentifier.class, "value", value);
	}

	public TargetIdentifier(String value) {
		this(value, false);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitTargetIdentifier(this);
	}
}
