package works.bolt.ast;

import works.bolt.host.AstNode;

/**
 * A node that produces a value when the compiler evaluates it.
 * <p>
 * The variant set is closed. Nodes only describe syntax; none of them evaluates anything.
 * Every expression is also usable as a {@link Subscript} and as a {@link CallArgument},
 * but never as a {@link Target}.
 */
public sealed interface Expression extends AstNode, Subscript, CallArgument permits
	BinaryExpression,
	UnaryExpression,
	ValueExpression,
	IdentifierExpression,
	FormatStringExpression,
	TupleExpression,
	ListExpression,
	DictExpression,
	AttributeExpression,
	LookupExpression,
	CallExpression
{
	<R> R accept(Visitor<R> visitor);

	/**
	 * One method per variant, so adding a variant breaks every visitor
	 * until it handles the new one.
	 */
	interface Visitor<R> {
		R visitBinaryExpression(BinaryExpression node);
		R visitUnaryExpression(UnaryExpression node);
		R visitValueExpression(ValueExpression node);
		R visitIdentifierExpression(IdentifierExpression node);
		R visitFormatStringExpression(FormatStringExpression node);
		R visitTupleExpression(TupleExpression node);
		R visitListExpression(ListExpression node);
		R visitDictExpression(DictExpression node);
		R visitAttributeExpression(AttributeExpression node);
		R visitLookupExpression(LookupExpression node);
		R visitCallExpression(CallExpression node);
	}
}
