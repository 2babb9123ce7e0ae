package works.bolt.ast;

import works.bolt.host.AstNode;

/**
 * Something that can appear in the argument list of a call:
 * a positional {@link Expression}, an {@link Unpack}, or a {@link Keyword} argument.
 */
public sealed interface CallArgument extends AstNode permits Expression, Unpack, Keyword {
}
