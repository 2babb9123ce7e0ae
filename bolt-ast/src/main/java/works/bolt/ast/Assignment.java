package works.bolt.ast;

import lombok.With;
import works.bolt.host.AstNode;

import static works.bolt.host.Attributes.required;

/**
 * Binds the value of one expression to one target.
 *
 * @param operator {@code "="}, or an augmented form like {@code "+="};
 *                 augmented assignments are not separate node types
 */
@With
public record Assignment(
	String operator,
	Target target,
	Expression value
) implements AstNode {
	public Assignment {
		required(Assignment.class, "operator", operator);
		required(Assignment.class, "target", target);
		required(Assignment.class, "value", value);
	}

	public boolean isAugmented() {
		return !"=".equals(operator);
	}
}
