/**
 * Exceptions thrown while constructing, rewriting, or resolving syntax trees.
 * All are unchecked and all extend {@link works.bolt.host.exceptions.AstException}.
 */
package works.bolt.host.exceptions;
