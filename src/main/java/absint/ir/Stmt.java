package absint.ir;

/**
 * An IR statement.
 */
public abstract sealed class Stmt extends IrNode permits Assign, Read, Use, Assume, Split, Loop {
	Stmt(NodeData data) {
		super(data);
	}
}
