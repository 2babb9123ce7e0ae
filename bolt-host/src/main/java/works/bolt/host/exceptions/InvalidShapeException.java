package works.bolt.host.exceptions;

/**
 * An attribute was supplied, but its value can't be represented by the node,
 * like a macro argument name that isn't shaped like an identifier.
 */
public final class InvalidShapeException extends AstException {
	private final Class<?> nodeType;

	public InvalidShapeException(Class<?> nodeType, String message) {
		super(fullMessage(nodeType, message));
		this.nodeType = nodeType;
	}

	public InvalidShapeException(Class<?> nodeType, String message, Throwable cause) {
		super(fullMessage(nodeType, message), cause);
		this.nodeType = nodeType;
	}

	public Class<?> nodeType() {
		return nodeType;
	}

	private static String fullMessage(Class<?> nodeType, String message) {
		return "Invalid " + nodeType.getSimpleName() + ": " + message;
	}
}
