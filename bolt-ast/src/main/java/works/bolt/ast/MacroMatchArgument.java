package works.bolt.ast;

import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.bolt.host.AstJson;
import works.bolt.host.ResourceLocation;

import static works.bolt.host.Attributes.required;

/**
 * Captures one argument of a macro-defined command.
 *
 * @param matchIdentifier the name the captured value is bound to
 * @param matchArgumentParser the external parser that consumes and interprets the argument,
 *                            like {@code brigadier:integer}
 * @param matchArgumentProperties configuration passed to that parser, if any
 */
@With
public record MacroMatchArgument(
	MacroArgument matchIdentifier,
	ResourceLocation matchArgumentParser,
	@Nullable AstJson matchArgumentProperties
) implements MacroMatch {
	public MacroMatchArgument {
		required(MacroMatchArgument.class, "matchIdentifier", matchIdentifier);
		required(MacroMatchArgument.class, "matchArgumentParser", matchArgumentParser);
	}

	public MacroMatchArgument(MacroArgument matchIdentifier, ResourceLocation matchArgumentParser) {
		this(matchIdentifier, matchArgumentParser, null);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitMacroMatchArgument(this);
	}
}
