package works.bolt.host.exceptions;

/**
 * A rewrite rule produced a replacement node that its new parent can't hold.
 */
public final class InvalidRewriteException extends AstException {
	public InvalidRewriteException(String message) {
		super(message);
	}

	public InvalidRewriteException(String message, Throwable cause) {
		super(message, cause);
	}
}
