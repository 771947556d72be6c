package absint.semantics;

import absint.ConfigurationException;
import absint.dataflow.Domains;
import absint.ir.BinExpr;
import absint.ir.Expr;
import absint.ir.Ident;
import absint.ir.Lit;
import absint.ir.UnExpr;
import absint.model.Model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Backward constraint propagation: narrows an environment so that an
 * expression evaluates within an expected value.
 *
 * The narrowed environment may be larger than the exact solution, but never
 * excludes a concrete environment satisfying the constraint.  An empty
 * result means no such environment exists.
 */
public final class ExprSolver {
	private final Model model;
	private final ExprEvaluator evaluator;

	public ExprSolver(Model model) {
		this.model = model;
		this.evaluator = new ExprEvaluator(model);
	}

	/**
	 * Solve a boolean predicate for {@code true}.
	 *
	 * @return The narrowed environment, or nothing if the predicate cannot hold.
	 */
	public Optional<Env> solve(Expr predicate, Env env) {
		return solve(predicate, env, Domains.TRUE);
	}

	/**
	 * @return The environment narrowed so that {@code expr} lies in
	 *         {@code expected}, or nothing if it cannot.
	 */
	public Optional<Env> solve(Expr expr, Env env, Object expected) {
		if (expr instanceof Ident ident) {
			var domain = this.model.domain(ident);
			var value = domain.meet(env.get(ident), expected);
			if (domain.isEmpty(value)) {
				return Optional.empty();
			}
			return Optional.of(env.with(ident, value));
		} else if (expr instanceof Lit lit) {
			var domain = this.model.domain(lit);
			var value = this.evaluator.eval(lit, env);
			if (domain.isEmpty(domain.meet(expected, value))) {
				return Optional.empty();
			}
			return Optional.of(env);
		} else if (expr instanceof UnExpr un) {
			var operand = this.evaluator.eval(un.getOperand(), env);
			return this.model.operation(un)
				.inverse()
				.apply(expected, List.of(operand))
				.flatMap(pre -> solve(un.getOperand(), env, pre.get(0)));
		} else if (expr instanceof BinExpr bin) {
			var lhs = this.evaluator.eval(bin.getLhs(), env);
			var rhs = this.evaluator.eval(bin.getRhs(), env);
			return this.model.operation(bin)
				.inverse()
				.apply(expected, Arrays.asList(lhs, rhs))
				.flatMap(pre -> solve(bin.getLhs(), env, pre.get(0))
					.flatMap(lhsEnv -> solve(bin.getRhs(), lhsEnv, pre.get(1))));
		} else {
			throw new ConfigurationException("Cannot solve '%s'", expr);
		}
	}
}
