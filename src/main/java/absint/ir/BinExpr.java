package absint.ir;

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.Objects;

/**
 * A binary operation.
 */
public final class BinExpr extends Expr {
	private final Expr lhs;
	private final Operator op;
	private final Expr rhs;

	public BinExpr(Expr lhs, Operator op, Expr rhs, NodeData data) {
		super(data);
		Preconditions.checkArgument(op.getArity() == 2, "%s is not a binary operator", op);
		this.lhs = Objects.requireNonNull(lhs);
		this.op = op;
		this.rhs = Objects.requireNonNull(rhs);
	}

	public Expr getLhs() {
		return this.lhs;
	}

	public Operator getOperator() {
		return this.op;
	}

	public Expr getRhs() {
		return this.rhs;
	}

	@Override
	public List<Expr> children() {
		return List.of(this.lhs, this.rhs);
	}
}
