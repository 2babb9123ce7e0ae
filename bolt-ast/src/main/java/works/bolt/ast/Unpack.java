package works.bolt.ast;

import lombok.With;

import static works.bolt.host.Attributes.required;

/**
 * A spread in a call.
 *
 * @param type {@link #SEQUENCE} or {@link #MAPPING}
 */
@With
public record Unpack(
	String type,
	Expression value
) implements CallArgument {
	public static final String SEQUENCE = "*";
	public static final String MAPPING = "**";

	public Unpack {
		required(Unpack.class, "type", type);
		required(Unpack.class, "value", value);
	}
}
