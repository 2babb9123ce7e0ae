package works.bolt.host;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import works.bolt.host.exceptions.InvalidShapeException;

/**
 * A JSON literal embedded in a command.
 * <p>
 * The tree mirrors JSON syntax, so object members keep their source order.
 *
 * @see JsonLiterals
 */
public sealed interface AstJson extends AstNode permits
	AstJsonValue,
	AstJsonArray,
	AstJsonObject
{
	/**
	 * @return the equivalent plain Java value: a {@link Map} (in member order),
	 * a {@link List}, a {@link String}, a {@link Number}, a {@link Boolean}, or null
	 */
	@Nullable Object evaluate();

	/**
	 * The inverse of {@link #evaluate()}.
	 *
	 * @throws InvalidShapeException if {@code value} contains something JSON can't represent
	 */
	static AstJson fromValue(@Nullable Object value) {
		if (value instanceof Map<?, ?> map) {
			List<AstJsonObjectEntry> entries = new ArrayList<>(map.size());
			map.forEach((k, v) -> {
				if (!(k instanceof String key)) {
					throw new InvalidShapeException(AstJsonObject.class, "member name must be a string, not " + k);
				}
				entries.add(new AstJsonObjectEntry(key, fromValue(v)));
			});
			return new AstJsonObject(AstChildren.from(entries));
		} else if (value instanceof List<?> list) {
			return new AstJsonArray(AstChildren.from(list.stream().map(AstJson::fromValue).toList()));
		} else {
			return new AstJsonValue(value);
		}
	}
}
