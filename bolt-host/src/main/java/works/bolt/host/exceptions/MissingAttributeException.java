package works.bolt.host.exceptions;

/**
 * A node was constructed without one of its required attributes.
 */
public final class MissingAttributeException extends AstException {
	private final Class<?> nodeType;
	private final String attributeName;

	public MissingAttributeException(Class<?> nodeType, String attributeName) {
		super("Missing required attribute " + nodeType.getSimpleName() + "." + attributeName);
		this.nodeType = nodeType;
		this.attributeName = attributeName;
	}

	public Class<?> nodeType() {
		return nodeType;
	}

	public String attributeName() {
		return attributeName;
	}
}
