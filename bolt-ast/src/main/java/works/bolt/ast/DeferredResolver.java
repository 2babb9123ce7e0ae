package works.bolt.ast;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bolt.host.AstNode;
import works.bolt.host.AstRewriter;
import works.bolt.host.SourceMap;
import works.bolt.host.SourceSpan;
import works.bolt.host.exceptions.DeferredResolutionException;

/**
 * Resolves {@link DeferredRoot}s, each region at most once.
 * <p>
 * A region counts as resolved as soon as resolution starts, so a parser that fails
 * still uses up its region. Regions are compared by value: two {@link DeferredRoot}s
 * for the same region are the same region.
 * <p>
 * One resolver should serve all the passes that work on a compilation unit.
 * It is safe to share between threads.
 */
public final class DeferredResolver {
	private final Set<SourceSpan> resolved = ConcurrentHashMap.newKeySet();
	@Nullable private final SourceMap sourceMap;

	public DeferredResolver() {
		this(null);
	}

	/**
	 * @param sourceMap if not null, each subtree produced by a parser
	 *                  is given the span of its region unless the parser already gave it one
	 */
	public DeferredResolver(@Nullable SourceMap sourceMap) {
		this.sourceMap = sourceMap;
	}

	/**
	 * @throws DeferredResolutionException if the region was already resolved,
	 *                                     or the parser produced nothing
	 */
	public <N extends AstNode> N resolve(DeferredRoot root, DeferredParser<? extends N> parser) {
		SourceSpan region = root.region();
		if (!resolved.add(region)) {
			throw new DeferredResolutionException("Deferred region " + region + " was already resolved");
		}
		LOGGER.debug("Resolving deferred region {}", region);
		N result = parser.parse(region);
		if (result == null) {
			throw new DeferredResolutionException("Parser produced nothing for deferred region " + region);
		}
		if (sourceMap != null && sourceMap.spanOf(result).isEmpty()) {
			sourceMap.attach(result, region);
		}
		return result;
	}

	/**
	 * Replaces every {@link DeferredRoot} in {@code tree} with its parsed subtree,
	 * including any that appear in the parsed subtrees themselves.
	 *
	 * @return {@code tree} itself if it contains no {@link DeferredRoot}
	 */
	public AstNode resolveAll(AstNode tree, DeferredParser<?> parser) {
		return rewrite(tree, node -> (node instanceof DeferredRoot d)
			? resolveAll(resolve(d, parser), parser)
			: node);
	}

	public boolean isResolved(DeferredRoot root) {
		return resolved.contains(root.region());
	}

	private AstNode rewrite(AstNode tree, UnaryOperator<AstNode> rule) {
		if (sourceMap == null) {
			return AstRewriter.rewrite(tree, rule);
		} else {
			return AstRewriter.rewrite(tree, rule, sourceMap);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DeferredResolver.class);
}
