package works.bolt.ast;

import works.bolt.host.AstLiteral;

import static works.bolt.host.Attributes.required;

/**
 * A keyword of a user-defined command, matched exactly.
 */
public record MacroLiteral(
	String value
) implements AstLiteral {
	public static final String PARSER = "bolt_macro_literal";

	public MacroLiteral {
		required(MacroLiteral.class, "value", value);
	}

	@Override
	public String parser() {
		return PARSER;
	}
}
