package works.bolt.host;

import lombok.With;

import static works.bolt.host.Attributes.required;

@With
public record AstJsonObjectEntry(
	String key,
	AstJson value
) implements AstNode {
	public AstJsonObjectEntry {
		required(AstJsonObjectEntry.class, "key", key);
		required(AstJsonObjectEntry.class, "value", value);
	}
}
