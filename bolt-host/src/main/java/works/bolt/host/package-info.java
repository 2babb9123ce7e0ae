/**
 * The host command language's side of the syntax tree contract.
 * <p>
 * Everything a script-language tree plugs into lives here:
 * the {@link works.bolt.host.AstNode} contract and its ordered child container
 * {@link works.bolt.host.AstChildren}, the root and command nodes,
 * literal, resource location, and JSON primitives,
 * and the generic machinery that works on any tree without knowing its node types,
 * namely {@link works.bolt.host.AstNode#children() child enumeration}
 * and {@link works.bolt.host.AstRewriter rewriting}.
 * <p>
 * Source positions are kept out of node attributes and tracked by
 * {@link works.bolt.host.SourceMap} instead.
 */
package works.bolt.host;
