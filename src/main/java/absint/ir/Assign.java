package absint.ir;

import java.util.List;
import java.util.Objects;

/**
 * {@code target := expr}
 */
public final class Assign extends Stmt {
	private final Ident target;
	private final Expr expr;

	public Assign(Ident target, Expr expr, NodeData data) {
		super(data);
		this.target = Objects.requireNonNull(target);
		this.expr = Objects.requireNonNull(expr);
	}

	public Ident getTarget() {
		return this.target;
	}

	public Expr getExpr() {
		return this.expr;
	}

	@Override
	public List<Expr> children() {
		return List.of(this.target, this.expr);
	}
}
