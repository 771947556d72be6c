package absint;

import absint.ir.Expr;
import absint.ir.Ident;
import absint.ir.Ir;
import absint.ir.NodeData;
import absint.ir.Operator;
import absint.ir.Program;
import absint.ir.Purpose;
import absint.ir.Stmt;
import absint.model.Models;
import absint.types.DefaultTypeInterpreter;
import absint.types.Type;
import absint.types.Typers;

import java.util.List;

/**
 * Types and programs shared by the tests.
 */
public final class TestPrograms {
	public static final Type BOOL = new Type.BooleanType();
	public static final Type INT = new Type.IntRangeType(-5, 5);
	public static final Type WIDE_INT = new Type.IntRangeType(-100, 100);
	public static final Type TAG = Type.EnumType.of("TagA", "TagB");
	public static final Type PTR = new Type.PointerType(INT);

	private TestPrograms() {
	}

	/**
	 * @return A Models object for the built-in types.
	 */
	public static Models models() {
		return new Models(Typers.defaults(), DefaultTypeInterpreter.INSTANCE);
	}

	public static Expr num(long n, Type type) {
		return Ir.lit(n, type);
	}

	public static Expr bin(Expr lhs, Operator op, Expr rhs, Type type) {
		return Ir.bin(lhs, op, rhs, type);
	}

	public static Expr cmp(Expr lhs, Operator op, Expr rhs) {
		return Ir.bin(lhs, op, rhs, BOOL);
	}

	/**
	 * <pre>
	 * x = 3
	 * if x &gt; 0 then y = x - 1 else y = 0
	 * </pre>
	 */
	public static Program split() {
		var x = Ir.ident("x", INT);
		var y = Ir.ident("y", INT);
		return Ir.program("split",
			Ir.assign(x, num(3, INT)),
			Ir.ifThenElse(cmp(x, Operator.GT, num(0, INT)),
				List.of(Ir.assign(y, bin(x, Operator.MINUS, num(1, INT), INT))),
				List.of(Ir.assign(y, num(0, INT)))));
	}

	/**
	 * <pre>
	 * x = 0
	 * while x &lt; bound loop x = x + 1
	 * </pre>
	 */
	public static Program counter(long bound) {
		var x = Ir.ident("x", WIDE_INT);
		return Ir.program("counter",
			Ir.assign(x, num(0, WIDE_INT)),
			Ir.loop(
				Ir.assume(cmp(x, Operator.LT, num(bound, WIDE_INT))),
				Ir.assign(x, bin(x, Operator.PLUS, num(1, WIDE_INT), WIDE_INT))),
			Ir.assume(Ir.un(Operator.NOT, cmp(x, Operator.LT, num(bound, WIDE_INT)), BOOL)));
	}

	/**
	 * <pre>
	 * read(p)
	 * if p == null then skip else skip
	 * x = *p
	 * </pre>
	 *
	 * with the dereference guarded by an assume tagged as a dereference check.
	 */
	public static Program nullDeref() {
		var p = Ir.ident("p", PTR);
		var x = Ir.ident("x", INT);
		return Ir.program("null_deref",
			Ir.read(p),
			Ir.ifThenElse(cmp(p, Operator.EQ, Ir.lit("null", PTR)), List.of(), List.of()),
			Ir.assume(cmp(p, Operator.NEQ, Ir.lit("null", PTR)), new Purpose.DerefCheck(p)),
			Ir.assign(x, Ir.un(Operator.DEREF, p, INT)));
	}

	/**
	 * <pre>
	 * read(tag)
	 * if tag == TagA then r.a else r.a
	 * </pre>
	 *
	 * where field {@code a} only exists under {@code TagA}.
	 */
	public static Program discriminant() {
		var tag = Ir.ident("tag", TAG);
		var r = new Ident("r", NodeData.empty());
		return Ir.program("discriminant",
			Ir.read(tag),
			Ir.ifThenElse(cmp(tag, Operator.EQ, Ir.lit("TagA", TAG)),
				List.of(existCheck(tag, r)),
				List.of(existCheck(tag, r))));
	}

	private static Stmt existCheck(Ident tag, Ident r) {
		return Ir.assume(cmp(tag, Operator.EQ, Ir.lit("TagA", TAG)), new Purpose.ExistCheck(r, "a", "tag"));
	}
}
