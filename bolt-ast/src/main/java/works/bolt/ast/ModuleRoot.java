package works.bolt.ast;

import works.bolt.host.AstChildren;
import works.bolt.host.AstCommand;
import works.bolt.host.AstRoot;

import static works.bolt.host.Attributes.required;

/**
 * The root of one compiled module.
 */
public record ModuleRoot(
	AstChildren<AstCommand> commands
) implements AstRoot {
	public ModuleRoot {
		required(ModuleRoot.class, "commands", commands);
	}
}
