package works.bolt.host.exceptions;

/**
 * A deferred region of input could not be resolved into a subtree,
 * most often because it was already resolved once.
 */
public final class DeferredResolutionException extends AstException {
	public DeferredResolutionException(String message) {
		super(message);
	}

	public DeferredResolutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
