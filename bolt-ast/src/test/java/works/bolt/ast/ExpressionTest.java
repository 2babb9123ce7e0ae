package works.bolt.ast;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.bolt.host.AstChildren;
import works.bolt.host.exceptions.MissingAttributeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExpressionTest {

	@Test
	void tuple_keepsItemOrder() {
		TupleExpression tuple = new TupleExpression(AstChildren.of(new ValueExpression(1), new ValueExpression(2)));

		List<Expression> items = new ArrayList<>();
		tuple.items().forEach(items::add);
		assertEquals(List.of(new ValueExpression(1), new ValueExpression(2)), items);

		TupleExpression reversed = new TupleExpression(AstChildren.of(new ValueExpression(2), new ValueExpression(1)));
		assertNotEquals(tuple, reversed);
	}

	@Test
	void independentlyBuiltNodes_areEqual() {
		Expression a = new CallExpression(
			new AttributeExpression("append", new IdentifierExpression("items")),
			AstChildren.of(new ValueExpression("x"), new Keyword("at", new ValueExpression(0))));
		Expression b = new CallExpression(
			new AttributeExpression("append", new IdentifierExpression("items")),
			AstChildren.of(new ValueExpression("x"), new Keyword("at", new ValueExpression(0))));
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
	}

	@Test
	void identifierWithoutValue_throws() {
		var e = assertThrows(MissingAttributeException.class, () -> new IdentifierExpression(null));
		assertEquals(IdentifierExpression.class, e.nodeType());
		assertEquals("value", e.attributeName());
	}

	@Test
	void listAndTuple_areDistinct() {
		AstChildren<Expression> items = AstChildren.of(new ValueExpression(1));
		assertNotEquals(new ListExpression(items), new TupleExpression(items));
	}

	@Test
	void dict_keepsDuplicateKeysInOrder() {
		DictItem first = new DictItem(new ValueExpression("k"), new ValueExpression(1));
		DictItem second = new DictItem(new ValueExpression("k"), new ValueExpression(2));
		DictExpression dict = new DictExpression(AstChildren.of(first, second));
		assertEquals(List.of(first, second), dict.items());
		assertNotEquals(dict, new DictExpression(AstChildren.of(second, first)));
	}

	@Test
	void lookup_mixesSlicesAndExpressions() {
		// grid[1:, i]
		LookupExpression lookup = new LookupExpression(
			new IdentifierExpression("grid"),
			AstChildren.of(
				new Slice(new ValueExpression(1), null, null),
				new IdentifierExpression("i")));
		assertEquals(new Slice().withStart(new ValueExpression(1)), lookup.arguments().get(0));
		assertEquals(new IdentifierExpression("i"), lookup.arguments().get(1));
	}

	@Test
	void call_keepsArgumentOrder() {
		// f(a, *rest, key=1, **opts)
		AstChildren<CallArgument> arguments = AstChildren.of(
			new IdentifierExpression("a"),
			new Unpack(Unpack.SEQUENCE, new IdentifierExpression("rest")),
			new Keyword("key", new ValueExpression(1)),
			new Unpack(Unpack.MAPPING, new IdentifierExpression("opts")));
		CallExpression call = new CallExpression(new IdentifierExpression("f"), arguments);
		assertEquals(arguments, call.arguments());
		assertEquals("**", ((Unpack) call.arguments().get(3)).type());
	}

	@Test
	void unpack_switchesKind() {
		Unpack rest = new Unpack(Unpack.SEQUENCE, new IdentifierExpression("rest"));
		assertEquals(new Unpack(Unpack.MAPPING, new IdentifierExpression("rest")), rest.withType(Unpack.MAPPING));
	}

	@Test
	void formatString_doesNotCheckPlaceholders() {
		FormatStringExpression fmt = new FormatStringExpression("{} and {}", AstChildren.of(new IdentifierExpression("only")));
		assertEquals(1, fmt.values().size());
	}

	@Test
	void none_isAValue() {
		ValueExpression none = new ValueExpression(ValueExpression.None.NONE);
		assertEquals(new ValueExpression(ValueExpression.None.NONE), none);
		assertEquals("None", none.value().toString());
	}

	@Test
	void withers_produceNewNodes() {
		BinaryExpression sum = new BinaryExpression("+", new ValueExpression(1), new ValueExpression(2));
		BinaryExpression product = sum.withOperator("*");
		assertEquals("+", sum.operator());
		assertEquals(new BinaryExpression("*", new ValueExpression(1), new ValueExpression(2)), product);
	}

	@Test
	void children_cannotBeMutatedThroughNode() {
		ListExpression list = new ListExpression(AstChildren.of(new ValueExpression(1)));
		assertThrows(UnsupportedOperationException.class, () -> list.items().add(new ValueExpression(2)));
		assertEquals(1, list.items().size());
	}
}
