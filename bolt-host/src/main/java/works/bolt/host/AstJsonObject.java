package works.bolt.host;

import java.util.LinkedHashMap;
import java.util.Map;

import static works.bolt.host.Attributes.required;

/**
 * A JSON object. Duplicate member names are kept as written;
 * {@link #evaluate()} keeps the last one, as JSON readers conventionally do.
 */
public record AstJsonObject(
	AstChildren<AstJsonObjectEntry> entries
) implements AstJson {
	public AstJsonObject {
		required(AstJsonObject.class, "entries", entries);
	}

	@Override
	public Map<String, Object> evaluate() {
		var result = new LinkedHashMap<String, Object>();
		entries.forEach(e -> result.put(e.key(), e.value().evaluate()));
		return result;
	}
}
