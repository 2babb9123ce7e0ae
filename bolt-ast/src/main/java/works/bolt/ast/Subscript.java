package works.bolt.ast;

import works.bolt.host.AstNode;

/**
 * Something that can appear between the brackets of a subscript: either
 * an {@link Expression} or a {@link Slice}.
 */
public sealed interface Subscript extends AstNode permits Expression, Slice {
}
