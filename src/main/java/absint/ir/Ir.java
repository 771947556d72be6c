package absint.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Factories for building IR programs.
 */
public final class Ir {
	private Ir() {
	}

	public static Program program(String name, Stmt... stmts) {
		return new Program(name, List.of(stmts));
	}

	public static Ident ident(String name, Object typeHint) {
		return new Ident(name, NodeData.typed(typeHint));
	}

	/**
	 * @return A temporary variable introduced by the frontend.
	 */
	public static Ident synthetic(String name, Object typeHint) {
		return new Ident(name, NodeData.typed(typeHint).withPurpose(new Purpose.SyntheticVariable()));
	}

	public static Lit lit(Object value, Object typeHint) {
		return new Lit(value, NodeData.typed(typeHint));
	}

	public static UnExpr un(Operator op, Expr operand, Object typeHint) {
		return new UnExpr(op, operand, NodeData.typed(typeHint));
	}

	public static BinExpr bin(Expr lhs, Operator op, Expr rhs, Object typeHint) {
		return new BinExpr(lhs, op, rhs, NodeData.typed(typeHint));
	}

	public static Assign assign(Ident target, Expr expr) {
		return new Assign(target, expr, NodeData.empty());
	}

	public static Read read(Ident target) {
		return new Read(target, NodeData.empty());
	}

	public static Use use(Ident target) {
		return new Use(target, NodeData.empty());
	}

	public static Assume assume(Expr expr) {
		return new Assume(expr, NodeData.empty());
	}

	public static Assume assume(Expr expr, Purpose purpose) {
		return new Assume(expr, NodeData.empty().withPurpose(purpose));
	}

	public static Split split(List<Stmt> first, List<Stmt> second) {
		return new Split(first, second, NodeData.empty());
	}

	public static Loop loop(Stmt... body) {
		return new Loop(List.of(body), NodeData.empty());
	}

	/**
	 * Lower {@code if cond then first else second} the way frontends do:
	 * each branch starts by assuming the condition (resp. its negation).
	 */
	public static Split ifThenElse(Expr cond, List<Stmt> first, List<Stmt> second) {
		var hint = cond.getData().getTypeHint().orElse(null);
		var notCond = new UnExpr(Operator.NOT, cond, NodeData.empty().withTypeHint(hint));

		var thenStmts = new ArrayList<Stmt>();
		thenStmts.add(assume(cond));
		thenStmts.addAll(first);

		var elseStmts = new ArrayList<Stmt>();
		elseStmts.add(assume(notCond));
		elseStmts.addAll(second);

		return split(thenStmts, elseStmts);
	}
}
