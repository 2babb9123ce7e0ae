package works.bolt.ast;

import works.bolt.host.AstChildren;

import static works.bolt.host.Attributes.required;

/**
 * A dict display. Items stay in source order, and duplicate keys are kept.
 */
public record DictExpression(
	AstChildren<DictItem> items
) implements Expression {
	public DictExpression {
		required(DictExpression.class, "items", items);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitDictExpression(this);
	}
}
