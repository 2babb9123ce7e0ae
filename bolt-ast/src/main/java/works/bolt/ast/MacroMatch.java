package works.bolt.ast;

import works.bolt.host.AstNode;

/**
 * One element of the pattern a macro-defined command matches.
 * A macro's full pattern is an ordered sequence of these.
 */
public sealed interface MacroMatch extends AstNode permits MacroMatchLiteral, MacroMatchArgument {
	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitMacroMatchLiteral(MacroMatchLiteral node);
		R visitMacroMatchArgument(MacroMatchArgument node);
	}
}
