package works.bolt.host;

import works.bolt.host.exceptions.MissingAttributeException;

/**
 * Construction-time checks shared by node constructors.
 */
public final class Attributes {
	private Attributes() {}

	/**
	 * Intended to be called from a compact constructor for each mandatory component.
	 *
	 * @return {@code value}
	 * @throws MissingAttributeException if {@code value} is null
	 */
	public static <T> T required(Class<?> nodeType, String name, T value) {
		if (value == null) {
			throw new MissingAttributeException(nodeType, name);
		}
		return value;
	}
}
