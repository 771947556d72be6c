package absint.dataflow;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Longs;

import java.util.Optional;

/**
 * The interval domain over a bounded integer range [min, max].
 *
 * Widening jumps unstable bounds straight to min/max, so any chain of
 * widenings stabilizes after at most two steps.
 */
public final class IntervalDomain implements Domain<Interval> {
	private final Interval range;

	public IntervalDomain(long min, long max) {
		Preconditions.checkArgument(min <= max, "Empty range [%s, %s]", min, max);
		this.range = Interval.of(min, max);
	}

	public long getMin() {
		return this.range.getLo();
	}

	public long getMax() {
		return this.range.getHi();
	}

	/**
	 * @return The abstract value of a constant (empty if outside the range).
	 */
	public Interval constant(long n) {
		return clamp(Interval.constant(n));
	}

	/**
	 * @return The interval [lo, hi] restricted to this domain's range.
	 */
	public Interval of(long lo, long hi) {
		return clamp(Interval.of(lo, hi));
	}

	/**
	 * @return The value restricted to this domain's range.
	 */
	public Interval clamp(Interval value) {
		return value.intersect(this.range);
	}

	/**
	 * Convert a literal's concrete representation (a number or its text).
	 */
	public Optional<Interval> parse(Object literal) {
		if (literal instanceof Number n) {
			return Optional.of(constant(n.longValue()));
		} else if (literal instanceof String s) {
			return Optional.ofNullable(Longs.tryParse(s.trim()))
				.map(this::constant);
		} else {
			return Optional.empty();
		}
	}

	@Override
	public Interval top() {
		return this.range;
	}

	@Override
	public Interval bottom() {
		return Interval.empty();
	}

	@Override
	public boolean isEmpty(Interval value) {
		return value.isEmpty();
	}

	@Override
	public boolean le(Interval a, Interval b) {
		return a.isSubsetOf(b);
	}

	@Override
	public Interval join(Interval a, Interval b) {
		return a.hull(b);
	}

	@Override
	public Interval meet(Interval a, Interval b) {
		return a.intersect(b);
	}

	@Override
	public Interval widen(Interval previous, Interval next) {
		if (previous.isEmpty()) {
			return next;
		} else if (next.isEmpty()) {
			return previous;
		}

		var lo = next.getLo() < previous.getLo() ? getMin() : previous.getLo();
		var hi = next.getHi() > previous.getHi() ? getMax() : previous.getHi();
		return Interval.of(lo, hi);
	}

	@Override
	public boolean isSingleton(Interval value) {
		return value.isConstant();
	}

	@Override
	public String toString() {
		return String.format("Int[%d, %d]", getMin(), getMax());
	}
}
