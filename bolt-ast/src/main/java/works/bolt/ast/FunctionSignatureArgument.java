package works.bolt.ast;

import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.bolt.host.AstNode;

import static works.bolt.host.Attributes.required;

/**
 * @param defaultValue present if and only if the argument may be omitted at call sites
 */
@With
public record FunctionSignatureArgument(
	String name,
	@Nullable Expression defaultValue
) implements AstNode {
	public FunctionSignatureArgument {
		required(FunctionSignatureArgument.class, "name", name);
	}

	public FunctionSignatureArgument(String name) {
		this(name, null);
	}

	public boolean isOptional() {
		return defaultValue != null;
	}
}
