package works.bolt.ast;

import works.bolt.host.AstNode;

import static works.bolt.host.Attributes.required;

public record Decorator(
	Expression expression
) implements AstNode {
	public Decorator {
		required(Decorator.class, "expression", expression);
	}
}
