package works.bolt.host.exceptions;

/**
 * Base of every failure raised while building or rewriting a syntax tree.
 * <p>
 * Nodes are only ever materialized fully formed, so any of these aborts
 * the current parse or rewrite step; there is no partial node to recover.
 */
public sealed abstract class AstException extends RuntimeException permits
	MissingAttributeException,
	InvalidShapeException,
	InvalidRewriteException,
	DeferredResolutionException
{
	protected AstException(String message) {
		super(message);
	}

	protected AstException(String message, Throwable cause) {
		super(message, cause);
	}
}
