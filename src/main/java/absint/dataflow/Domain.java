package absint.dataflow;

import java.util.Collection;

/**
 * An abstract domain: a lattice over values of type T.
 *
 * Values are immutable; the domain object carries the lattice operations.
 * Domain instances are compared by identity, so every node of a given type
 * must be interpreted with the same instance.
 */
public interface Domain<T> {
	/**
	 * @return The top element (every concrete value).
	 */
	T top();

	/**
	 * @return The bottom element (no concrete value).
	 */
	T bottom();

	/**
	 * @return Whether the value represents no concrete value.
	 */
	boolean isEmpty(T value);

	/**
	 * @return Whether a ⊑ b.
	 */
	boolean le(T a, T b);

	/**
	 * @return The least upper bound of a and b.
	 */
	T join(T a, T b);

	/**
	 * @return The greatest lower bound of a and b.
	 */
	T meet(T a, T b);

	/**
	 * Extrapolate from a previous value to a new one.  The result is above
	 * join(previous, next), and every chain of successive widenings is
	 * finite.
	 */
	T widen(T previous, T next);

	/**
	 * @return Whether the value represents exactly one concrete value.
	 */
	boolean isSingleton(T value);

	/**
	 * @return The join of many values.
	 */
	default T join(Collection<T> values) {
		var ret = bottom();
		for (var value : values) {
			ret = join(ret, value);
		}
		return ret;
	}

	/**
	 * @return Whether a and b represent the same concrete values.
	 */
	default boolean eq(T a, T b) {
		return le(a, b) && le(b, a);
	}
}
