package works.bolt.host;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.bolt.host.exceptions.InvalidShapeException;

/**
 * Converts between JSON text and {@link AstJson} trees.
 */
public final class JsonLiterals {
	private static final ObjectMapper MAPPER = JsonMapper.builder().build();

	private JsonLiterals() {}

	/**
	 * @throws InvalidShapeException if {@code text} is not valid JSON
	 */
	public static AstJson parse(String text) {
		Object value;
		try {
			value = MAPPER.readValue(text, Object.class);
		} catch (JacksonException e) {
			throw new InvalidShapeException(AstJson.class, "malformed JSON: " + e.getMessage(), e);
		}
		return AstJson.fromValue(value);
	}

	public static String render(AstJson json) {
		return MAPPER.writeValueAsString(json.evaluate());
	}
}
