package absint.dataflow;

import com.google.common.collect.ImmutableSet;

/**
 * Shared domain instances and values.
 */
public final class Domains {
	/** The boolean domain, shared by every analysis. */
	public static final FiniteSetDomain<Boolean> BOOLEAN = FiniteSetDomain.of("Boolean", false, true);

	public static final ImmutableSet<Boolean> TRUE = ImmutableSet.of(true);
	public static final ImmutableSet<Boolean> FALSE = ImmutableSet.of(false);
	public static final ImmutableSet<Boolean> BOTH = BOOLEAN.top();
	public static final ImmutableSet<Boolean> NEITHER = BOOLEAN.bottom();

	private Domains() {
	}

	/**
	 * @return The abstract value of a concrete boolean.
	 */
	public static ImmutableSet<Boolean> bool(boolean b) {
		return b ? TRUE : FALSE;
	}

	/**
	 * @return The abstract boolean from whether each outcome is possible.
	 */
	public static ImmutableSet<Boolean> bool(boolean canBeTrue, boolean canBeFalse) {
		if (canBeTrue && canBeFalse) {
			return BOTH;
		} else if (canBeTrue) {
			return TRUE;
		} else if (canBeFalse) {
			return FALSE;
		} else {
			return NEITHER;
		}
	}

	/**
	 * @return A fresh nullness domain for one pointer type.
	 */
	public static FiniteSetDomain<Nullness> access(String name) {
		return FiniteSetDomain.of(name, Nullness.NULL, Nullness.NON_NULL);
	}
}
