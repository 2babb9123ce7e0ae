package works.bolt.ast;

import lombok.With;
import works.bolt.host.AstChildren;
import works.bolt.host.AstNode;

import static works.bolt.host.Attributes.required;

/**
 * The header of a function definition.
 * <p>
 * Nothing here checks that arguments without defaults come before those with defaults.
 *
 * @param decorators in source order; null is taken to mean none
 * @param arguments  required even when the function takes none, in which case it's empty
 */
@With
public record FunctionSignature(
	AstChildren<Decorator> decorators,
	String name,
	AstChildren<FunctionSignatureArgument> arguments
) implements AstNode {
	public FunctionSignature {
		if (decorators == null) {
			decorators = AstChildren.empty();
		}
		required(FunctionSignature.class, "name", name);
		required(FunctionSignature.class, "arguments", arguments);
	}

	public FunctionSignature(String name, AstChildren<FunctionSignatureArgument> arguments) {
		this(AstChildren.empty(), name, arguments);
	}
}
