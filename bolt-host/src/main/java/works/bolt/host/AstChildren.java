package works.bolt.host;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.RandomAccess;
import java.util.function.Function;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import static java.util.Objects.requireNonNull;

/**
 * The ordered container for every node attribute that holds a sequence of child nodes.
 * <p>
 * Order is exactly the order supplied; nothing is ever sorted or deduplicated.
 * Equality follows {@link java.util.List#equals}, so two containers are equal
 * if they hold equal nodes in the same order.
 * <p>
 * All the {@link java.util.List} mutators throw {@link UnsupportedOperationException}.
 * To derive a different sequence, use the persistent operations
 * {@link #plus}, {@link #with}, and {@link #map}, which leave this one untouched.
 */
public final class AstChildren<T extends AstNode> extends AbstractList<T> implements RandomAccess {
	private static final AstChildren<?> EMPTY = new AstChildren<>(TreePVector.empty());

	private final PVector<T> nodes;

	private AstChildren(PVector<T> nodes) {
		this.nodes = nodes;
	}

	@SuppressWarnings("unchecked")
	public static <T extends AstNode> AstChildren<T> empty() {
		return (AstChildren<T>) EMPTY;
	}

	@SafeVarargs
	public static <T extends AstNode> AstChildren<T> of(T... nodes) {
		return from(Arrays.asList(nodes));
	}

	@SuppressWarnings("unchecked")
	public static <T extends AstNode> AstChildren<T> from(Iterable<? extends T> nodes) {
		if (nodes instanceof AstChildren) {
			// Immutable, so widening the element type is safe
			return (AstChildren<T>) nodes;
		}
		PVector<T> result = TreePVector.empty();
		int index = 0;
		for (T node: nodes) {
			result = result.plus(requireNonNull(node, "AstChildren can't contain null (index " + index + ")"));
			++index;
		}
		if (result.isEmpty()) {
			return empty();
		}
		return new AstChildren<>(result);
	}

	@Override
	public T get(int index) {
		return nodes.get(index);
	}

	@Override
	public int size() {
		return nodes.size();
	}

	/**
	 * @return a new container with {@code node} appended
	 */
	public AstChildren<T> plus(T node) {
		return new AstChildren<>(nodes.plus(requireNonNull(node)));
	}

	/**
	 * @return a new container with the node at {@code index} replaced by {@code node}
	 */
	public AstChildren<T> with(int index, T node) {
		return new AstChildren<>(nodes.with(index, requireNonNull(node)));
	}

	/**
	 * @return a container holding {@code mapper} applied to each node, in order
	 */
	public <R extends AstNode> AstChildren<R> map(Function<? super T, ? extends R> mapper) {
		return from(nodes.stream().map(mapper).toList());
	}
}
