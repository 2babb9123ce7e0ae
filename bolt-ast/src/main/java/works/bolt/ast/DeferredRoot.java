package works.bolt.ast;

import works.bolt.host.AstNode;
import works.bolt.host.SourceSpan;

import static works.bolt.host.Attributes.required;

/**
 * Stands in for a region of input whose parsing is postponed.
 * <p>
 * The node only records where the region lies. A {@link DeferredResolver} hands that
 * region to a parser later, and the caller then uses the resulting subtree in place of this node.
 *
 * @param region the unconsumed input
 */
public record DeferredRoot(
	SourceSpan region
) implements AstNode {
	public DeferredRoot {
		required(DeferredRoot.class, "region", region);
	}
}
