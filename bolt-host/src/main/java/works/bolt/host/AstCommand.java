package works.bolt.host;

import lombok.With;

import static works.bolt.host.Attributes.required;

/**
 * One host-language command.
 *
 * @param identifier names the command prototype the arguments were parsed against,
 *                   like {@code "say:message"}
 * @param arguments  the parsed arguments, in source order
 */
@With
public record AstCommand(
	String identifier,
	AstChildren<AstNode> arguments
) implements AstNode {
	public AstCommand {
		required(AstCommand.class, "identifier", identifier);
		required(AstCommand.class, "arguments", arguments);
	}
}
