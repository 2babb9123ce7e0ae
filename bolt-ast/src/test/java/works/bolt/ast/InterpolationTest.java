package works.bolt.ast;

import org.junit.jupiter.api.Test;
import works.bolt.host.AstChildren;
import works.bolt.host.AstNode;
import works.bolt.host.AstRewriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class InterpolationTest {
	final Interpolation interpolation = new Interpolation("str", new IdentifierExpression("score"));

	@Test
	void prefixAndUnpackAreAbsentByDefault() {
		assertNull(interpolation.prefix());
		assertNull(interpolation.unpack());
		assertEquals("str", interpolation.converter());
		assertEquals(new IdentifierExpression("score"), interpolation.value());
	}

	@Test
	void copies_areEqual() {
		assertEquals(interpolation, interpolation.withPrefix(null));
		assertEquals(interpolation, new Interpolation(
			interpolation.prefix(), interpolation.unpack(), interpolation.converter(), interpolation.value()));
		assertSame(interpolation, AstRewriter.rewrite(interpolation, n -> n));
	}

	@Test
	void prefixTakesPartInEquality() {
		Interpolation prefixed = interpolation.withPrefix("#");
		assertEquals("#", prefixed.prefix());
		assertNotEquals(interpolation, prefixed);
	}

	@Test
	void valueIsTheOnlyChild() {
		Interpolation unpacked = new Interpolation(null, "*", "json", new ListExpression(
			AstChildren.of(new ValueExpression(1), new ValueExpression(2))));
		assertEquals(1, unpacked.children().size());
		assertEquals(4, unpacked.walk().count());
		AstNode first = unpacked.children().get(0);
		assertSame(unpacked.value(), first);
	}
}
