package absint.ir;

import java.util.List;
import java.util.Objects;

/**
 * {@code assume expr}: execution only continues where the boolean expression holds.
 */
public final class Assume extends Stmt {
	private final Expr expr;

	public Assume(Expr expr, NodeData data) {
		super(data);
		this.expr = Objects.requireNonNull(expr);
	}

	public Expr getExpr() {
		return this.expr;
	}

	@Override
	public List<Expr> children() {
		return List.of(this.expr);
	}
}
