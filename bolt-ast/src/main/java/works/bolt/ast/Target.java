package works.bolt.ast;

import works.bolt.host.AstNode;

/**
 * Something that can be bound or assigned to.
 * <p>
 * Targets mirror some expression shapes but are a separate family:
 * a target is never accepted where an {@link Expression} is expected, nor the reverse,
 * so the compiler can tell "evaluate this" from "assign to this" by type alone.
 */
public sealed interface Target extends AstNode permits
	TargetIdentifier,
	TargetUnpack,
	TargetAttribute,
	TargetItem
{
	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitTargetIdentifier(TargetIdentifier node);
		R visitTargetUnpack(TargetUnpack node);
		R visitTargetAttribute(TargetAttribute node);
		R visitTargetItem(TargetItem node);
	}
}
