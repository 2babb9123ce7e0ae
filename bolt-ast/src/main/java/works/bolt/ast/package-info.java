/**
 * Syntax tree for bolt, the Python-like scripting language embedded in the host command language.
 * <p>
 * The nodes fall into a few families:
 *
 * <ul>
 *     <li>
 *         {@link works.bolt.ast.Expression}, values the compiler evaluates, along with
 *         the non-expression pieces they're built from ({@link works.bolt.ast.Slice},
 *         {@link works.bolt.ast.Unpack}, {@link works.bolt.ast.Keyword}, {@link works.bolt.ast.DictItem});
 *     </li>
 *     <li>
 *         {@link works.bolt.ast.Target}, the things that can be assigned to;
 *     </li>
 *     <li>
 *         statements and declarations such as {@link works.bolt.ast.Assignment}
 *         and {@link works.bolt.ast.FunctionSignature};
 *     </li>
 *     <li>
 *         {@link works.bolt.ast.MacroMatch}, the pattern of a user-defined command; and
 *     </li>
 *     <li>
 *         {@link works.bolt.ast.DeferredRoot} and {@link works.bolt.ast.Interpolation},
 *         which connect script syntax with the surrounding host syntax.
 *     </li>
 * </ul>
 *
 * {@link works.bolt.ast.Expression}, {@link works.bolt.ast.Target}, and {@link works.bolt.ast.MacroMatch}
 * are sealed, and each has a {@code Visitor} with one method per variant.
 * Heterogeneous child lists use the sealed unions {@link works.bolt.ast.Subscript}
 * and {@link works.bolt.ast.CallArgument} rather than a common untyped base.
 * <p>
 * Every node is a record. Required attributes are checked on construction
 * and optional ones are annotated {@code @Nullable}.
 */
package works.bolt.ast;
