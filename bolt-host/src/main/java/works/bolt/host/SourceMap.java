package works.bolt.host;

import com.google.common.collect.MapMaker;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

import static java.util.Objects.requireNonNull;

/**
 * Side table attaching source spans and arbitrary metadata to the nodes of one compilation unit.
 * <p>
 * Keys are node <em>instances</em>, not node values: two equal nodes built from different
 * parts of the source keep their own spans. This is why spans live here rather than in
 * node attributes, where they would take part in equality.
 * <p>
 * Nodes are held weakly. Once no pass references a node, it can be collected
 * and its entry disappears with it.
 * <p>
 * Safe for concurrent use, so passes that share a tree can also share its map.
 */
public final class SourceMap {
	// Weak keys are compared by identity
	private final ConcurrentMap<AstNode, Entry> entries = new MapMaker().weakKeys().makeMap();

	private record Entry(@Nullable SourceSpan span, PMap<String, Object> metadata) {
		static final Entry EMPTY = new Entry(null, HashTreePMap.empty());
	}

	public void attach(AstNode node, SourceSpan span) {
		requireNonNull(span);
		entries.compute(requireNonNull(node), (n, e) ->
			new Entry(span, (e == null) ? Entry.EMPTY.metadata() : e.metadata()));
	}

	public Optional<SourceSpan> spanOf(AstNode node) {
		Entry entry = entries.get(node);
		return (entry == null) ? Optional.empty() : Optional.ofNullable(entry.span());
	}

	public void putMetadata(AstNode node, String key, Object value) {
		requireNonNull(key);
		requireNonNull(value);
		entries.compute(requireNonNull(node), (n, e) -> {
			Entry existing = (e == null) ? Entry.EMPTY : e;
			return new Entry(existing.span(), existing.metadata().plus(key, value));
		});
	}

	public Optional<Object> metadata(AstNode node, String key) {
		Entry entry = entries.get(node);
		return (entry == null) ? Optional.empty() : Optional.ofNullable(entry.metadata().get(key));
	}

	/**
	 * Gives {@code replacement} the span of {@code original}, unless it already has one.
	 * Metadata is not carried over.
	 */
	public void inherit(AstNode original, AstNode replacement) {
		spanOf(original).ifPresent(span ->
			entries.compute(replacement, (n, e) -> {
				if (e == null) {
					return new Entry(span, Entry.EMPTY.metadata());
				} else if (e.span() == null) {
					return new Entry(span, e.metadata());
				} else {
					return e;
				}
			}));
	}

	/**
	 * @return the number of entries, which may still count nodes that were just collected
	 */
	public int size() {
		return entries.size();
	}
}
