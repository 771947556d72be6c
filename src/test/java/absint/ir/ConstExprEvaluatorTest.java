package absint.ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConstExprEvaluatorTest {
	private static Lit lit(Object value) {
		return new Lit(value, NodeData.empty());
	}

	private static BinExpr bin(Expr lhs, Operator op, Expr rhs) {
		return new BinExpr(lhs, op, rhs, NodeData.empty());
	}

	@Test
	public void arithmetic() throws NotConstExprException {
		var evaluator = new ConstExprEvaluator();
		assertEquals(5L, evaluator.evalLong(bin(lit(2), Operator.PLUS, lit("3"))));
		assertEquals(-4L, evaluator.evalLong(new UnExpr(Operator.NEG, bin(lit(1L), Operator.MINUS, lit(-3L)), NodeData.empty())));
	}

	@Test
	public void logic() throws NotConstExprException {
		var evaluator = new ConstExprEvaluator();
		var lt = bin(lit(1), Operator.LT, lit(2));
		assertEquals(true, evaluator.eval(lt));
		assertEquals(false, evaluator.eval(new UnExpr(Operator.NOT, lt, NodeData.empty())));
		assertEquals(true, evaluator.eval(bin(lit("TagA"), Operator.EQ, lit("TagA"))));
		assertEquals(false, evaluator.eval(bin(lt, Operator.AND, lit(false))));
	}

	@Test
	public void identifiersAreNotConstant() {
		var x = new Ident("x", NodeData.empty());
		var e = assertThrows(NotConstExprException.class,
			() -> new ConstExprEvaluator().eval(bin(lit(1), Operator.PLUS, x)));
		assertSame(x, e.getExpr());
	}

	@Test
	public void overflowIsNotConstant() {
		var big = bin(lit(Long.MAX_VALUE), Operator.PLUS, lit(1));
		assertThrows(NotConstExprException.class, () -> new ConstExprEvaluator().eval(big));
	}

	@Test
	public void typeErrorsAreNotConstant() {
		assertThrows(NotConstExprException.class,
			() -> new ConstExprEvaluator().evalLong(bin(lit(1), Operator.LT, lit(2))));
	}
}
