package works.bolt.host;

import org.jetbrains.annotations.Nullable;
import works.bolt.host.exceptions.InvalidShapeException;

/**
 * A JSON scalar.
 *
 * @param value a {@link String}, {@link Number}, or {@link Boolean}; null for JSON {@code null}
 */
public record AstJsonValue(
	@Nullable Object value
) implements AstJson {
	public static final AstJsonValue NULL = new AstJsonValue(null);

	public AstJsonValue {
		if (value != null
			&& !(value instanceof String)
			&& !(value instanceof Number)
			&& !(value instanceof Boolean)) {
			throw new InvalidShapeException(AstJsonValue.class, "not a JSON scalar: " + value.getClass().getSimpleName());
		}
	}

	@Override
	public @Nullable Object evaluate() {
		return value;
	}
}
