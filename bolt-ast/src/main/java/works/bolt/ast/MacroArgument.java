package works.bolt.ast;

import java.util.regex.Pattern;
import works.bolt.host.AstLiteral;
import works.bolt.host.exceptions.InvalidShapeException;

import static works.bolt.host.Attributes.required;

/**
 * The name a macro argument is bound to.
 * Only identifier-shaped names can be represented at all.
 */
public record MacroArgument(
	String value
) implements AstLiteral {
	public static final String PARSER = "bolt_macro_argument";
	public static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

	public MacroArgument {
		required(MacroArgument.class, "value", value);
		if (!IDENTIFIER.matcher(value).matches()) {
			throw new InvalidShapeException(MacroArgument.class, "\"" + value + "\" is not an identifier");
		}
	}

	@Override
	public String parser() {
		return PARSER;
	}
}
