package works.bolt.host;

import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bolt.host.exceptions.InvalidRewriteException;

/**
 * Bottom-up tree rewriting.
 * <p>
 * Each node's children are rewritten first; if any of them changed,
 * the node is rebuilt through its canonical constructor, so every
 * construction-time check runs again on the new node.
 * Then {@code rule} is applied to the (possibly rebuilt) node.
 * <p>
 * Subtrees that the rule leaves alone come back as the very same instances,
 * and a rule result equal to its input is discarded in favour of the input.
 * Callers can therefore use {@code ==} to tell whether anything changed.
 */
public final class AstRewriter {
	private final Function<? super AstNode, ? extends AstNode> rule;
	@Nullable private final SourceMap sourceMap;

	private AstRewriter(Function<? super AstNode, ? extends AstNode> rule, @Nullable SourceMap sourceMap) {
		this.rule = rule;
		this.sourceMap = sourceMap;
	}

	public static AstNode rewrite(AstNode root, Function<? super AstNode, ? extends AstNode> rule) {
		return new AstRewriter(rule, null).rewriteNode(root);
	}

	/**
	 * Like {@link #rewrite(AstNode, Function)}, but each replacement node that
	 * has no span of its own inherits the span of the node it replaces.
	 */
	public static AstNode rewrite(AstNode root, Function<? super AstNode, ? extends AstNode> rule, SourceMap sourceMap) {
		return new AstRewriter(rule, sourceMap).rewriteNode(root);
	}

	private AstNode rewriteNode(AstNode node) {
		NodeShape shape = NodeShape.of(node.getClass());
		AstNode rebuilt = node;
		if (shape.isRebuildable()) {
			Object[] values = shape.values(node);
			boolean changed = false;
			for (int i = 0; i < values.length; i++) {
				NodeShape.Component component = shape.components.get(i);
				Object replacement = values[i];
				if (values[i] instanceof AstChildren<?> children) {
					replacement = rewriteChildren(shape, component, children);
				} else if (values[i] instanceof AstNode child) {
					replacement = checked(shape, component, component.type(), rewriteNode(child));
				}
				if (replacement != values[i]) {
					values[i] = replacement;
					changed = true;
				}
			}
			if (changed) {
				rebuilt = construct(shape, values);
				LOGGER.trace("Rebuilt {}", shape.nodeType.getSimpleName());
			}
		}
		AstNode result = rule.apply(rebuilt);
		if (result == null) {
			throw new InvalidRewriteException("Rewrite rule returned null for " + rebuilt.getClass().getSimpleName());
		} else if (result != rebuilt && result.equals(rebuilt)) {
			result = rebuilt;
		}
		if (result != node && sourceMap != null) {
			sourceMap.inherit(node, result);
		}
		return result;
	}

	private AstChildren<?> rewriteChildren(NodeShape shape, NodeShape.Component component, AstChildren<?> children) {
		AstChildren<AstNode> result = AstChildren.from(children);
		for (int i = 0; i < children.size(); i++) {
			AstNode original = children.get(i);
			AstNode replacement = checked(shape, component, component.elementType(), rewriteNode(original));
			if (replacement != original) {
				result = result.with(i, replacement);
			}
		}
		return result;
	}

	private static AstNode checked(NodeShape shape, NodeShape.Component component, Class<?> expectedType, AstNode replacement) {
		if (!expectedType.isInstance(replacement)) {
			throw new InvalidRewriteException("Can't place " + replacement.getClass().getSimpleName()
				+ " in " + shape.nodeType.getSimpleName() + "." + component.name()
				+ "; expected " + expectedType.getSimpleName());
		}
		return replacement;
	}

	private static AstNode construct(NodeShape shape, Object[] values) {
		try {
			return shape.construct(values);
		} catch (ClassCastException e) {
			throw new InvalidRewriteException("Can't rebuild " + shape.nodeType.getSimpleName(), e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AstRewriter.class);
}
