package absint.types;

import absint.ir.ConstExprEvaluator;
import absint.ir.Expr;
import absint.ir.NotConstExprException;
import absint.util.Log;

import java.util.Objects;
import java.util.Optional;

/**
 * Built-in typers.
 */
public final class Typers {
	private Typers() {
	}

	/**
	 * A range type hint whose bounds are static expressions.
	 */
	public record RangeHint(Expr min, Expr max) {
		public RangeHint {
			Objects.requireNonNull(min);
			Objects.requireNonNull(max);
		}
	}

	/**
	 * @return A typer for hints that already are semantic types.
	 */
	public static Typer<Object> direct() {
		return Typer.forClass(Type.class, Optional::of);
	}

	/**
	 * @return A typer for {@link RangeHint}s.  A bound that is not static
	 *         leaves that side of the range unbounded.
	 */
	public static Typer<Object> ranges() {
		return Typer.forClass(RangeHint.class, hint -> {
			var evaluator = new ConstExprEvaluator();
			var min = bound(evaluator, hint.min(), Long.MIN_VALUE);
			var max = bound(evaluator, hint.max(), Long.MAX_VALUE);
			if (min > max) {
				Log.warn("Empty range %s .. %s", hint.min(), hint.max());
				return Optional.empty();
			}
			return Optional.of(new Type.IntRangeType(min, max));
		});
	}

	private static long bound(ConstExprEvaluator evaluator, Expr expr, long unbounded) {
		try {
			return evaluator.evalLong(expr);
		} catch (NotConstExprException e) {
			Log.debug("Dynamic range bound %s", expr);
			return unbounded;
		}
	}

	/**
	 * @return The typer for every built-in hint.
	 */
	public static Typer<Object> defaults() {
		return direct().or(ranges());
	}
}
