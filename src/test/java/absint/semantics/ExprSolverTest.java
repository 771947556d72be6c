package absint.semantics;

import absint.ConfigurationException;
import absint.TestPrograms;
import absint.dataflow.Domains;
import absint.dataflow.IntervalDomain;
import absint.ir.Expr;
import absint.ir.Ident;
import absint.ir.Ir;
import absint.ir.Operator;
import absint.ir.Stmt;
import absint.model.Model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

public class ExprSolverTest {
	private final Ident x = Ir.ident("x", TestPrograms.INT);
	private final Ident b = Ir.ident("b", TestPrograms.BOOL);

	private Model model(Expr... exprs) {
		var stmts = new Stmt[exprs.length];
		for (int i = 0; i < exprs.length; ++i) {
			stmts[i] = Ir.assume(exprs[i]);
		}
		return TestPrograms.models().of(Ir.program("exprs", stmts));
	}

	private static Expr num(long n) {
		return TestPrograms.num(n, TestPrograms.INT);
	}

	@Test
	public void evaluation() {
		var minus = TestPrograms.bin(this.x, Operator.MINUS, num(1), TestPrograms.INT);
		var gt = TestPrograms.cmp(this.x, Operator.GT, num(0));
		var model = model(TestPrograms.cmp(minus, Operator.EQ, num(0)), gt);
		var ints = (IntervalDomain) model.get(this.x).getDomain();
		var evaluator = new ExprEvaluator(model);

		var env = Env.of(Map.of(this.x, ints.constant(3)));
		assertEquals(ints.constant(2), evaluator.eval(minus, env));
		assertEquals(Domains.TRUE, evaluator.eval(gt, env));

		env = Env.of(Map.of(this.x, ints.top()));
		assertEquals(ints.of(-5, 4), evaluator.eval(minus, env));
		assertEquals(Domains.BOTH, evaluator.eval(gt, env));
	}

	@Test
	public void unboundVariables() {
		var model = model(TestPrograms.cmp(this.x, Operator.GT, num(0)));
		var evaluator = new ExprEvaluator(model);
		assertThrows(ConfigurationException.class, () -> evaluator.eval(this.x, Env.empty()));
	}

	@Test
	public void narrowComparisons() {
		var gt = TestPrograms.cmp(this.x, Operator.GT, num(2));
		var model = model(gt);
		var ints = (IntervalDomain) model.get(this.x).getDomain();
		var solver = new ExprSolver(model);

		var env = Env.of(Map.of(this.x, ints.top()));
		assertEquals(ints.of(3, 5), solver.solve(gt, env).get().get(this.x));
	}

	@Test
	public void narrowThroughArithmetic() {
		var plus = TestPrograms.bin(this.x, Operator.PLUS, num(1), TestPrograms.INT);
		var eq = TestPrograms.cmp(plus, Operator.EQ, num(3));
		var model = model(eq);
		var ints = (IntervalDomain) model.get(this.x).getDomain();

		var env = Env.of(Map.of(this.x, ints.top()));
		assertEquals(ints.constant(2), new ExprSolver(model).solve(eq, env).get().get(this.x));
	}

	@Test
	public void infeasibleComparisons() {
		var lt = TestPrograms.cmp(this.x, Operator.LT, num(0));
		var model = model(lt);
		var ints = (IntervalDomain) model.get(this.x).getDomain();

		var env = Env.of(Map.of(this.x, ints.constant(3)));
		assertFalse(new ExprSolver(model).solve(lt, env).isPresent());
	}

	@Test
	public void infeasibleIdentifiers() {
		var model = model(this.b);
		var solver = new ExprSolver(model);
		assertFalse(solver.solve(this.b, Env.of(Map.of(this.b, Domains.FALSE))).isPresent());
		assertEquals(Domains.TRUE, solver.solve(this.b, Env.of(Map.of(this.b, Domains.BOTH))).get().get(this.b));
	}

	@Test
	public void literals() {
		var yes = Ir.lit(true, TestPrograms.BOOL);
		var no = Ir.lit(false, TestPrograms.BOOL);
		var model = model(yes, no);
		var solver = new ExprSolver(model);
		assertEquals(Env.empty(), solver.solve(yes, Env.empty()).get());
		assertFalse(solver.solve(no, Env.empty()).isPresent());
	}

	@Test
	public void negations() {
		var lt = TestPrograms.cmp(this.x, Operator.LT, num(0));
		var not = Ir.un(Operator.NOT, lt, TestPrograms.BOOL);
		var model = model(not);
		var ints = (IntervalDomain) model.get(this.x).getDomain();

		var env = Env.of(Map.of(this.x, ints.top()));
		assertEquals(ints.of(0, 5), new ExprSolver(model).solve(not, env).get().get(this.x));
	}

	@Test
	public void overApproximation() {
		// Intervals cannot exclude 0 from [-5, 5], so nothing is lost
		var neq = TestPrograms.cmp(this.x, Operator.NEQ, num(0));
		var model = model(neq);
		var ints = (IntervalDomain) model.get(this.x).getDomain();

		var env = Env.of(Map.of(this.x, ints.top()));
		assertEquals(ints.top(), new ExprSolver(model).solve(neq, env).get().get(this.x));

		env = Env.of(Map.of(this.x, ints.of(0, 3)));
		assertEquals(ints.of(1, 3), new ExprSolver(model).solve(neq, env).get().get(this.x));
	}

	@Test
	public void conjunctions() {
		var ge = TestPrograms.cmp(this.x, Operator.GE, num(1));
		var le = TestPrograms.cmp(this.x, Operator.LE, num(2));
		var and = Ir.bin(ge, Operator.AND, le, TestPrograms.BOOL);
		var model = model(and);
		var ints = (IntervalDomain) model.get(this.x).getDomain();

		var env = Env.of(Map.of(this.x, ints.top()));
		assertEquals(ints.of(1, 2), new ExprSolver(model).solve(and, env).get().get(this.x));
	}
}
