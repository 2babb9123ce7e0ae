package works.bolt.ast;

import static works.bolt.host.Attributes.required;

public record MacroMatchLiteral(
	MacroLiteral match
) implements MacroMatch {
	public MacroMatchLiteral {
		required(MacroMatchLiteral.class, "match", match);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitMacroMatchLiteral(this);
	}
}
