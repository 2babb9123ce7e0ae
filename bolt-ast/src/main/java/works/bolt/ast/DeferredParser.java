package works.bolt.ast;

import works.bolt.host.AstNode;
import works.bolt.host.SourceSpan;

/**
 * Parses one deferred region of input, starting fresh at the region's start.
 */
@FunctionalInterface
public interface DeferredParser<N extends AstNode> {
	N parse(SourceSpan region);
}
