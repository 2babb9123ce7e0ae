package works.bolt.ast;

import lombok.With;

import static works.bolt.host.Attributes.required;

/**
 * {@code name=value} in a call.
 */
@With
public record Keyword(
	String name,
	Expression value
) implements CallArgument {
	public Keyword {
		required(Keyword.class, "name", name);
		required(Keyword.class, "value", value);
	}
}
