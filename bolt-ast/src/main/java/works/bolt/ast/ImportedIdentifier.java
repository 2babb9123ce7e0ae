package works.bolt.ast;

import works.bolt.host.AstNode;

import static works.bolt.host.Attributes.required;

/**
 * A name bound by an import statement, as in the {@code sqrt} of {@code from math import sqrt}.
 */
public record ImportedIdentifier(
	String value
) implements AstNode {
	public ImportedIdentifier {
		required(ImportedIdentifier.class, "value", value);
	}
}
