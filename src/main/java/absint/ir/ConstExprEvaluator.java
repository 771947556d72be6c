package absint.ir;

import com.google.common.primitives.Longs;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Evaluates expressions statically, for typers that need constant folding
 * (range bounds, static discriminant values, ...).
 *
 * Values are {@code Long} for integers, {@code Boolean} for booleans and
 * {@code String} for any other literal.  Results are memoized per evaluator.
 */
public final class ConstExprEvaluator {
	private final Map<Expr, Object> memo = new IdentityHashMap<>();

	/**
	 * @return The value of the expression.
	 * @throws NotConstExprException
	 *         If the expression has a non-constant sub-term.
	 */
	public Object eval(Expr expr) throws NotConstExprException {
		var cached = this.memo.get(expr);
		if (cached != null) {
			return cached;
		}

		Object value;
		try {
			value = compute(expr);
		} catch (ArithmeticException e) {
			// Overflow is not statically decidable either
			throw new NotConstExprException(expr);
		}
		this.memo.put(expr, value);
		return value;
	}

	/**
	 * @return The value of an integer expression.
	 */
	public long evalLong(Expr expr) throws NotConstExprException {
		var value = eval(expr);
		if (value instanceof Long l) {
			return l;
		}
		throw new NotConstExprException(expr);
	}

	private Object compute(Expr expr) throws NotConstExprException {
		if (expr instanceof Lit lit) {
			return normalize(lit.getValue());
		} else if (expr instanceof UnExpr un) {
			var operand = eval(un.getOperand());
			switch (un.getOperator()) {
			case NOT:
				return !asBoolean(un, operand);
			case NEG:
				return Math.negateExact(asLong(un, operand));
			default:
				throw new NotConstExprException(expr);
			}
		} else if (expr instanceof BinExpr bin) {
			var lhs = eval(bin.getLhs());
			var rhs = eval(bin.getRhs());
			switch (bin.getOperator()) {
			case PLUS:
				return Math.addExact(asLong(bin, lhs), asLong(bin, rhs));
			case MINUS:
				return Math.subtractExact(asLong(bin, lhs), asLong(bin, rhs));
			case LT:
				return asLong(bin, lhs) < asLong(bin, rhs);
			case LE:
				return asLong(bin, lhs) <= asLong(bin, rhs);
			case GT:
				return asLong(bin, lhs) > asLong(bin, rhs);
			case GE:
				return asLong(bin, lhs) >= asLong(bin, rhs);
			case EQ:
				return lhs.equals(rhs);
			case NEQ:
				return !lhs.equals(rhs);
			case AND:
				return asBoolean(bin, lhs) && asBoolean(bin, rhs);
			case OR:
				return asBoolean(bin, lhs) || asBoolean(bin, rhs);
			default:
				throw new NotConstExprException(expr);
			}
		} else {
			// Identifiers are never constant
			throw new NotConstExprException(expr);
		}
	}

	private static Object normalize(Object value) {
		if (value instanceof Integer i) {
			return i.longValue();
		} else if (value instanceof String s) {
			Long parsed = Longs.tryParse(s);
			if (parsed != null) {
				return parsed;
			}
		}
		return value;
	}

	private static long asLong(Expr expr, Object value) throws NotConstExprException {
		if (value instanceof Long l) {
			return l;
		}
		throw new NotConstExprException(expr);
	}

	private static boolean asBoolean(Expr expr, Object value) throws NotConstExprException {
		if (value instanceof Boolean b) {
			return b;
		}
		throw new NotConstExprException(expr);
	}
}
