package works.bolt.host;

/**
 * The top of a tree: an ordered list of commands.
 */
public interface AstRoot extends AstNode {
	AstChildren<AstCommand> commands();
}
