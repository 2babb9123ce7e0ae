package works.bolt.host;

import org.junit.jupiter.api.Test;
import works.bolt.host.exceptions.InvalidRewriteException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AstRewriterTest {
	final AstJson json = JsonLiterals.parse("""
		{"name": "steve", "tags": ["a", "b"], "count": 3}
		""");
	final AstCommand command = new AstCommand("data:merge", AstChildren.of(ResourceLocation.of("chest"), json));

	@Test
	void identityRule_returnsSameTree() {
		assertSame(command, AstRewriter.rewrite(command, n -> n));
	}

	@Test
	void equalReplacement_isDiscarded() {
		AstNode result = AstRewriter.rewrite(command, n -> (n instanceof AstJsonValue v) ? new AstJsonValue(v.value()) : n);
		assertSame(command, result);
	}

	@Test
	void changedLeaf_rebuildsOnlyItsAncestors() {
		AstCommand result = (AstCommand) AstRewriter.rewrite(command, n ->
			(n instanceof AstJsonValue v && "a".equals(v.value())) ? new AstJsonValue("A") : n);

		assertNotSame(command, result);
		assertSame(command.arguments().get(0), result.arguments().get(0));
		assertEquals(
			JsonLiterals.parse("""
				{"name": "steve", "tags": ["A", "b"], "count": 3}
				"""),
			result.arguments().get(1));
		AstJsonObject before = (AstJsonObject) command.arguments().get(1);
		AstJsonObject after = (AstJsonObject) result.arguments().get(1);
		assertSame(before.entries().get(0), after.entries().get(0));
		assertSame(before.entries().get(2), after.entries().get(2));
	}

	@Test
	void wrongChildType_throws() {
		var e = assertThrows(InvalidRewriteException.class, () -> AstRewriter.rewrite(command, n ->
			(n instanceof AstJsonArray) ? ResourceLocation.of("nope") : n));
		assertTrue(e.getMessage().contains("AstJsonObjectEntry.value"), e.getMessage());
	}

	@Test
	void nullFromRule_throws() {
		assertThrows(InvalidRewriteException.class, () -> AstRewriter.rewrite(command, n ->
			(n instanceof ResourceLocation) ? null : n));
	}

	@Test
	void replacements_inheritSpans() {
		SourceMap sourceMap = new SourceMap();
		SourceSpan span = new SourceSpan(new SourceLocation(5, 1, 6), new SourceLocation(10, 1, 11));
		AstNode location = command.arguments().get(0);
		sourceMap.attach(location, span);

		AstCommand result = (AstCommand) AstRewriter.rewrite(command, n ->
			(n instanceof ResourceLocation) ? ResourceLocation.of("barrel") : n, sourceMap);

		assertEquals(span, sourceMap.spanOf(result.arguments().get(0)).orElseThrow());
		assertTrue(sourceMap.spanOf(result).isEmpty());
	}
}
