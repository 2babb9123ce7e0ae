package works.bolt.host;

/**
 * A node holding one literal token exactly as it appeared in the source.
 */
public interface AstLiteral extends AstNode {
	String value();

	/**
	 * @return the name of the argument parser that produces this kind of literal
	 */
	String parser();
}
