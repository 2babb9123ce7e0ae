package works.bolt.ast;

import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.bolt.host.AstNode;

import static works.bolt.host.Attributes.required;

/**
 * Splices the value of a script expression into host-language output.
 *
 * @param prefix literal text placed before the spliced value, if any
 * @param unpack if present, the value is spread across several host tokens instead of rendered as one
 * @param converter names the rule that renders the evaluated value, like {@code "str"} or {@code "json"}
 */
@With
public record Interpolation(
	@Nullable String prefix,
	@Nullable String unpack,
	String converter,
	Expression value
) implements AstNode {
	public Interpolation {
		required(Interpolation.class, "converter", converter);
		required(Interpolation.class, "value", value);
	}

	public Interpolation(String converter, Expression value) {
		this(null, null, converter, value);
	}
}
