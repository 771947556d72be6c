package absint.ir;

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.Objects;

/**
 * A unary operation.
 */
public final class UnExpr extends Expr {
	private final Operator op;
	private final Expr operand;

	public UnExpr(Operator op, Expr operand, NodeData data) {
		super(data);
		Preconditions.checkArgument(op.getArity() == 1, "%s is not a unary operator", op);
		this.op = op;
		this.operand = Objects.requireNonNull(operand);
	}

	public Operator getOperator() {
		return this.op;
	}

	public Expr getOperand() {
		return this.operand;
	}

	@Override
	public List<Expr> children() {
		return List.of(this.operand);
	}
}
