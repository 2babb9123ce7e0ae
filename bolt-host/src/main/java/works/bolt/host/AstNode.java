package works.bolt.host;

import java.util.function.UnaryOperator;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A node in a syntax tree.
 * <p>
 * Nodes are immutable values: two nodes are equal if they have the same type
 * and all their attributes are equal, including the order of any {@link AstChildren}.
 * A tree is never modified in place; passes that need a different tree build one,
 * usually with {@link AstRewriter}.
 * <p>
 * Source positions and other metadata are deliberately not attributes,
 * so they never affect equality. See {@link SourceMap}.
 * <p>
 * Implementations are expected to be public records.
 * Generic tree walkers rely on this to enumerate {@link #children()} and
 * to rebuild nodes without knowing their concrete types.
 */
public interface AstNode {
	/**
	 * @return the direct children of this node in attribute declaration order,
	 * with the elements of any {@link AstChildren} attribute spliced in place
	 */
	default AstChildren<AstNode> children() {
		return NodeShape.of(getClass()).children(this);
	}

	/**
	 * @return this node followed by all its descendants, in pre-order
	 */
	default Stream<AstNode> walk() {
		return Stream.concat(
			Stream.of(this),
			children().stream().flatMap(AstNode::walk));
	}

	/**
	 * Helper to produce a modified node of the same type as a given
	 * node but with different attribute values.
	 *
	 * @return <code>transformation.apply(original)</code>,
	 * unless the result is equal to {@code original},
	 * in which case {@code original} is returned.
	 */
	static <N extends AstNode> N transform(N original, UnaryOperator<N> transformation) {
		N candidate = transformation.apply(requireNonNull(original));
		if (original.equals(candidate)) {
			return original;
		} else {
			return candidate;
		}
	}
}
