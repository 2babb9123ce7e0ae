package works.bolt.host;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.bolt.host.exceptions.InvalidShapeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonLiteralsTest {

	@Test
	void parse_buildsTreeInMemberOrder() {
		AstJson json = JsonLiterals.parse("""
			{"min": 0, "max": 10, "flags": [true, null, "x"]}
			""");
		assertEquals(
			new AstJsonObject(AstChildren.of(
				new AstJsonObjectEntry("min", new AstJsonValue(0)),
				new AstJsonObjectEntry("max", new AstJsonValue(10)),
				new AstJsonObjectEntry("flags", new AstJsonArray(AstChildren.of(
					new AstJsonValue(true),
					AstJsonValue.NULL,
					new AstJsonValue("x")
				)))
			)),
			json);
	}

	@Test
	void evaluate() {
		AstJson json = JsonLiterals.parse("""
			{"min": 0, "names": ["a", null]}
			""");
		assertEquals(
			Map.of("min", 0, "names", Arrays.asList("a", null)),
			json.evaluate());
		assertEquals(List.of("min", "names"), List.copyOf(((Map<?, ?>) json.evaluate()).keySet()));
	}

	@Test
	void render() {
		AstJson json = new AstJsonObject(AstChildren.of(
			new AstJsonObjectEntry("min", new AstJsonValue(1)),
			new AstJsonObjectEntry("tags", new AstJsonArray(AstChildren.of(new AstJsonValue("a"))))
		));
		assertEquals("{\"min\":1,\"tags\":[\"a\"]}", JsonLiterals.render(json));
	}

	@Test
	void malformed_throws() {
		assertThrows(InvalidShapeException.class, () -> JsonLiterals.parse("{\"min\": "));
	}

	@Test
	void nonScalar_throws() {
		assertThrows(InvalidShapeException.class, () -> new AstJsonValue(new Object()));
		assertThrows(InvalidShapeException.class, () -> AstJson.fromValue(Map.of(1, "one")));
	}
}
