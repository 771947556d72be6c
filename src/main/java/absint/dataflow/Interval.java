package absint.dataflow;

import com.google.common.math.LongMath;

import java.util.OptionalLong;

/**
 * An integer interval [lo, hi].
 *
 * The empty interval is encoded as lo == 1, hi == 0.  Arithmetic saturates at
 * the bounds of long; the enclosing {@link IntervalDomain} clamps results to
 * its range.
 */
public final class Interval {
	private static final Interval EMPTY = new Interval(1, 0);

	private final long lo;
	private final long hi;

	private Interval(long lo, long hi) {
		this.lo = lo;
		this.hi = hi;
	}

	/**
	 * @return The interval [lo, hi], or the empty interval if lo > hi.
	 */
	public static Interval of(long lo, long hi) {
		if (lo > hi) {
			return EMPTY;
		} else {
			return new Interval(lo, hi);
		}
	}

	/**
	 * @return The singleton interval [n, n].
	 */
	public static Interval constant(long n) {
		return new Interval(n, n);
	}

	/**
	 * @return The empty interval.
	 */
	public static Interval empty() {
		return EMPTY;
	}

	/**
	 * @return Whether this interval contains no integer.
	 */
	public boolean isEmpty() {
		return this.lo > this.hi;
	}

	public long getLo() {
		return this.lo;
	}

	public long getHi() {
		return this.hi;
	}

	/**
	 * @return Whether this interval contains exactly one integer.
	 */
	public boolean isConstant() {
		return this.lo == this.hi;
	}

	/**
	 * @return The value of this interval, if it is a singleton.
	 */
	public OptionalLong getIfConstant() {
		if (isConstant()) {
			return OptionalLong.of(this.lo);
		} else {
			return OptionalLong.empty();
		}
	}

	/**
	 * @return Whether this interval contains the given number.
	 */
	public boolean contains(long n) {
		return this.lo <= n && n <= this.hi;
	}

	/**
	 * @return Whether this ⊆ other.
	 */
	public boolean isSubsetOf(Interval other) {
		return isEmpty() || (other.lo <= this.lo && this.hi <= other.hi);
	}

	/**
	 * @return The smallest interval containing both.
	 */
	public Interval hull(Interval other) {
		if (isEmpty()) {
			return other;
		} else if (other.isEmpty()) {
			return this;
		}
		return of(Math.min(this.lo, other.lo), Math.max(this.hi, other.hi));
	}

	/**
	 * @return The intersection of both intervals.
	 */
	public Interval intersect(Interval other) {
		if (isEmpty() || other.isEmpty()) {
			return EMPTY;
		}
		return of(Math.max(this.lo, other.lo), Math.min(this.hi, other.hi));
	}

	/** @return this + rhs */
	public Interval add(Interval rhs) {
		if (isEmpty() || rhs.isEmpty()) {
			return EMPTY;
		}
		return of(LongMath.saturatedAdd(this.lo, rhs.lo), LongMath.saturatedAdd(this.hi, rhs.hi));
	}

	/** @return this - rhs */
	public Interval subtract(Interval rhs) {
		if (isEmpty() || rhs.isEmpty()) {
			return EMPTY;
		}
		return of(LongMath.saturatedSubtract(this.lo, rhs.hi), LongMath.saturatedSubtract(this.hi, rhs.lo));
	}

	/** @return -this */
	public Interval negate() {
		if (isEmpty()) {
			return EMPTY;
		}
		return of(LongMath.saturatedSubtract(0, this.hi), LongMath.saturatedSubtract(0, this.lo));
	}

	/**
	 * @return This interval without the given number, when that is expressible.
	 */
	public Interval remove(long n) {
		if (this.lo == n) {
			return of(LongMath.saturatedAdd(n, 1), this.hi);
		} else if (this.hi == n) {
			return of(this.lo, LongMath.saturatedSubtract(n, 1));
		} else {
			return this;
		}
	}

	@Override
	public int hashCode() {
		return isEmpty() ? 0 : Long.hashCode(31 * this.lo + this.hi);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj instanceof Interval other) {
			return this.lo == other.lo
				&& this.hi == other.hi;
		} else {
			return false;
		}
	}

	@Override
	public String toString() {
		if (isEmpty()) {
			return "⊥";
		} else if (isConstant()) {
			return String.format("{%d}", this.lo);
		} else {
			return String.format("[%d, %d]", this.lo, this.hi);
		}
	}
}
