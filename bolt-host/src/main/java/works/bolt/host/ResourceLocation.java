package works.bolt.host;

import java.util.regex.Pattern;
import lombok.With;
import org.jetbrains.annotations.Nullable;
import works.bolt.host.exceptions.InvalidShapeException;

import static works.bolt.host.Attributes.required;

/**
 * A namespaced identifier, like {@code minecraft:stone} or {@code #minecraft:logs}.
 *
 * @param isTag whether the location was written with a leading {@code #}
 * @param namespace null when the source omitted it; see {@link #effectiveNamespace()}
 * @param path everything after the colon
 */
@With
public record ResourceLocation(
	boolean isTag,
	@Nullable String namespace,
	String path
) implements AstNode {
	public static final String DEFAULT_NAMESPACE = "minecraft";

	private static final Pattern NAMESPACE = Pattern.compile("[0-9a-z_.\\-]+");
	private static final Pattern PATH = Pattern.compile("[0-9a-z_.\\-/]+");

	public ResourceLocation {
		required(ResourceLocation.class, "path", path);
		if (namespace != null && !NAMESPACE.matcher(namespace).matches()) {
			throw new InvalidShapeException(ResourceLocation.class, "illegal namespace \"" + namespace + "\"");
		}
		if (!PATH.matcher(path).matches()) {
			throw new InvalidShapeException(ResourceLocation.class, "illegal path \"" + path + "\"");
		}
	}

	public static ResourceLocation of(String text) {
		required(ResourceLocation.class, "text", text);
		boolean isTag = text.startsWith("#");
		String rest = isTag ? text.substring(1) : text;
		int colon = rest.indexOf(':');
		if (colon < 0) {
			return new ResourceLocation(isTag, null, rest);
		} else {
			return new ResourceLocation(isTag, rest.substring(0, colon), rest.substring(colon + 1));
		}
	}

	public String effectiveNamespace() {
		return (namespace == null) ? DEFAULT_NAMESPACE : namespace;
	}

	/**
	 * @return the location as it would be written, with the namespace made explicit
	 */
	public String value() {
		return (isTag ? "#" : "") + effectiveNamespace() + ":" + path;
	}

	@Override
	public String toString() {
		return value();
	}
}
