package works.bolt.ast;

import lombok.With;
import works.bolt.host.AstNode;

import static works.bolt.host.Attributes.required;

@With
public record DictItem(
	Expression key,
	Expression value
) implements AstNode {
	public DictItem {
		required(DictItem.class, "key", key);
		required(DictItem.class, "value", value);
	}
}
