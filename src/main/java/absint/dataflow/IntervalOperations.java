package absint.dataflow;

import absint.dataflow.Operation.Preimage;
import absint.ir.Operator;

import com.google.common.collect.ImmutableSet;
import com.google.common.math.LongMath;

import java.util.Optional;

/**
 * Operator semantics over an {@link IntervalDomain}.
 */
public final class IntervalOperations implements OperationProvider {
	private final IntervalDomain domain;

	public IntervalOperations(IntervalDomain domain) {
		this.domain = domain;
	}

	@Override
	public Optional<Operation> lookup(Operator op, Signature sig) {
		if (op.isComparison()) {
			if (sig.arity() == 2 && sig.operand(0) == this.domain && sig.operand(1) == this.domain
				&& sig.result() == Domains.BOOLEAN) {
				return Optional.of(comparison(op));
			}
			return Optional.empty();
		}

		if (!sig.is(this.domain, this.domain)) {
			return Optional.empty();
		}

		switch (op) {
		case PLUS:
			return Optional.of(Operation.binary(this::add, this::invertAdd));
		case MINUS:
			return Optional.of(Operation.binary(this::subtract, this::invertSubtract));
		case NEG:
			return Optional.of(Operation.<Interval, Interval>unary(this::negate, this::invertNegate));
		default:
			return Optional.empty();
		}
	}

	/** @return lhs + rhs */
	public Interval add(Interval lhs, Interval rhs) {
		return this.domain.clamp(lhs.add(rhs));
	}

	/** @return lhs - rhs */
	public Interval subtract(Interval lhs, Interval rhs) {
		return this.domain.clamp(lhs.subtract(rhs));
	}

	/** @return -operand */
	public Interval negate(Interval operand) {
		return this.domain.clamp(operand.negate());
	}

	private static Optional<Preimage<Interval, Interval>> preimage(Interval lhs, Interval rhs) {
		if (lhs.isEmpty() || rhs.isEmpty()) {
			return Optional.empty();
		} else {
			return Optional.of(new Preimage<>(lhs, rhs));
		}
	}

	private Optional<Preimage<Interval, Interval>> invertAdd(Interval expected, Interval lhs, Interval rhs) {
		// l + r = e  <=>  l = e - r  <=>  r = e - l
		return preimage(
			lhs.intersect(expected.subtract(rhs)),
			rhs.intersect(expected.subtract(lhs)));
	}

	private Optional<Preimage<Interval, Interval>> invertSubtract(Interval expected, Interval lhs, Interval rhs) {
		// l - r = e  <=>  l = e + r  <=>  r = l - e
		return preimage(
			lhs.intersect(expected.add(rhs)),
			rhs.intersect(lhs.subtract(expected)));
	}

	private Optional<Interval> invertNegate(Interval expected, Interval operand) {
		var ret = operand.intersect(expected.negate());
		return ret.isEmpty() ? Optional.empty() : Optional.of(ret);
	}

	/**
	 * A comparison, described by the narrowing it implies on its operands
	 * when it holds and when it does not.
	 */
	@FunctionalInterface
	private interface Narrowing {
		Preimage<Interval, Interval> apply(Interval lhs, Interval rhs);
	}

	private Operation comparison(Operator op) {
		Narrowing whenTrue;
		Narrowing whenFalse;
		switch (op) {
		case LT:
			whenTrue = this::narrowLt;
			whenFalse = this::narrowGe;
			break;
		case LE:
			whenTrue = this::narrowLe;
			whenFalse = this::narrowGt;
			break;
		case GT:
			whenTrue = this::narrowGt;
			whenFalse = this::narrowLe;
			break;
		case GE:
			whenTrue = this::narrowGe;
			whenFalse = this::narrowLt;
			break;
		case EQ:
			whenTrue = this::narrowEq;
			whenFalse = this::narrowNeq;
			break;
		case NEQ:
			whenTrue = this::narrowNeq;
			whenFalse = this::narrowEq;
			break;
		default:
			throw new IllegalArgumentException(op.toString());
		}

		return Operation.<Interval, Interval, ImmutableSet<Boolean>>binary(
			(lhs, rhs) -> compare(lhs, rhs, whenTrue, whenFalse),
			(expected, lhs, rhs) -> invertComparison(expected, lhs, rhs, whenTrue, whenFalse));
	}

	private static boolean feasible(Preimage<Interval, Interval> p) {
		return !p.lhs().isEmpty() && !p.rhs().isEmpty();
	}

	/**
	 * The outcome is possible exactly when its narrowing leaves both operands
	 * non-empty.
	 */
	private static ImmutableSet<Boolean> compare(Interval lhs, Interval rhs, Narrowing whenTrue, Narrowing whenFalse) {
		if (lhs.isEmpty() || rhs.isEmpty()) {
			return Domains.NEITHER;
		}
		return Domains.bool(feasible(whenTrue.apply(lhs, rhs)), feasible(whenFalse.apply(lhs, rhs)));
	}

	private static Optional<Preimage<Interval, Interval>> invertComparison(
		ImmutableSet<Boolean> expected,
		Interval lhs,
		Interval rhs,
		Narrowing whenTrue,
		Narrowing whenFalse
	) {
		var newLhs = Interval.empty();
		var newRhs = Interval.empty();

		if (expected.contains(true)) {
			var p = whenTrue.apply(lhs, rhs);
			if (feasible(p)) {
				newLhs = newLhs.hull(p.lhs());
				newRhs = newRhs.hull(p.rhs());
			}
		}

		if (expected.contains(false)) {
			var p = whenFalse.apply(lhs, rhs);
			if (feasible(p)) {
				newLhs = newLhs.hull(p.lhs());
				newRhs = newRhs.hull(p.rhs());
			}
		}

		return preimage(newLhs, newRhs);
	}

	private static long inc(long n) {
		return LongMath.saturatedAdd(n, 1);
	}

	private static long dec(long n) {
		return LongMath.saturatedSubtract(n, 1);
	}

	private Interval atMost(long n) {
		return Interval.of(this.domain.getMin(), n);
	}

	private Interval atLeast(long n) {
		return Interval.of(n, this.domain.getMax());
	}

	/** Narrow for lhs < rhs. */
	private Preimage<Interval, Interval> narrowLt(Interval lhs, Interval rhs) {
		return new Preimage<>(
			lhs.intersect(atMost(dec(rhs.getHi()))),
			rhs.intersect(atLeast(inc(lhs.getLo()))));
	}

	/** Narrow for lhs <= rhs. */
	private Preimage<Interval, Interval> narrowLe(Interval lhs, Interval rhs) {
		return new Preimage<>(
			lhs.intersect(atMost(rhs.getHi())),
			rhs.intersect(atLeast(lhs.getLo())));
	}

	/** Narrow for lhs > rhs. */
	private Preimage<Interval, Interval> narrowGt(Interval lhs, Interval rhs) {
		var p = narrowLt(rhs, lhs);
		return new Preimage<>(p.rhs(), p.lhs());
	}

	/** Narrow for lhs >= rhs. */
	private Preimage<Interval, Interval> narrowGe(Interval lhs, Interval rhs) {
		var p = narrowLe(rhs, lhs);
		return new Preimage<>(p.rhs(), p.lhs());
	}

	/** Narrow for lhs == rhs. */
	private Preimage<Interval, Interval> narrowEq(Interval lhs, Interval rhs) {
		var both = lhs.intersect(rhs);
		return new Preimage<>(both, both);
	}

	/** Narrow for lhs != rhs. */
	private Preimage<Interval, Interval> narrowNeq(Interval lhs, Interval rhs) {
		var newLhs = lhs;
		var newRhs = rhs;
		if (rhs.isConstant()) {
			newLhs = lhs.remove(rhs.getLo());
		}
		if (lhs.isConstant()) {
			newRhs = rhs.remove(lhs.getLo());
		}
		return new Preimage<>(newLhs, newRhs);
	}
}
