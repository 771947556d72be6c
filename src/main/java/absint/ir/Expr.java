package absint.ir;

/**
 * An IR expression.
 */
public abstract sealed class Expr extends IrNode permits Ident, Lit, UnExpr, BinExpr {
	Expr(NodeData data) {
		super(data);
	}
}
