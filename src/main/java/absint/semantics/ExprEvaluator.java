package absint.semantics;

import absint.ConfigurationException;
import absint.ir.BinExpr;
import absint.ir.Expr;
import absint.ir.Ident;
import absint.ir.Lit;
import absint.ir.UnExpr;
import absint.model.Model;

import java.util.Arrays;
import java.util.List;

/**
 * Forward abstract evaluation of expressions.
 *
 * Every node of an evaluated expression must be in the model.
 */
public final class ExprEvaluator {
	private final Model model;

	public ExprEvaluator(Model model) {
		this.model = model;
	}

	/**
	 * @return The abstract value of the expression in the environment.
	 */
	public Object eval(Expr expr, Env env) {
		if (expr instanceof Ident ident) {
			return env.get(ident);
		} else if (expr instanceof Lit lit) {
			return this.model.builder(lit).build(lit.getValue());
		} else if (expr instanceof UnExpr un) {
			var operand = eval(un.getOperand(), env);
			return this.model.operation(un)
				.definition()
				.apply(List.of(operand));
		} else if (expr instanceof BinExpr bin) {
			var lhs = eval(bin.getLhs(), env);
			var rhs = eval(bin.getRhs(), env);
			return this.model.operation(bin)
				.definition()
				.apply(Arrays.asList(lhs, rhs));
		} else {
			throw new ConfigurationException("Cannot evaluate '%s'", expr);
		}
	}
}
