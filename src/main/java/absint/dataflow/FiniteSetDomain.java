package absint.dataflow;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;

/**
 * The powerset domain over a finite universe of elements.
 *
 * Used for booleans, enumerations and pointer nullness.  The lattice has
 * finite height, so widening is plain join.
 */
public final class FiniteSetDomain<E> implements Domain<ImmutableSet<E>> {
	private final String name;
	private final ImmutableSet<E> universe;

	private FiniteSetDomain(String name, ImmutableSet<E> universe) {
		Preconditions.checkArgument(!universe.isEmpty(), "Empty universe for %s", name);
		this.name = name;
		this.universe = universe;
	}

	/**
	 * Create a powerset domain.  Each call creates a distinct domain, even
	 * for equal universes.
	 */
	public static <U> FiniteSetDomain<U> of(String name, Collection<U> universe) {
		return new FiniteSetDomain<>(name, ImmutableSet.copyOf(universe));
	}

	@SafeVarargs
	public static <U> FiniteSetDomain<U> of(String name, U... universe) {
		return of(name, Arrays.asList(universe));
	}

	public String getName() {
		return this.name;
	}

	public ImmutableSet<E> getUniverse() {
		return this.universe;
	}

	/**
	 * @return The abstract value holding exactly the given elements.
	 */
	@SafeVarargs
	public final ImmutableSet<E> valueOf(E... elements) {
		var ret = ImmutableSet.copyOf(elements);
		Preconditions.checkArgument(this.universe.containsAll(ret), "%s is not a subset of %s", ret, this);
		return ret;
	}

	/**
	 * Convert a literal's concrete representation to a singleton.
	 */
	public Optional<ImmutableSet<E>> parse(Object literal) {
		for (var element : this.universe) {
			if (element.equals(literal) || element.toString().equals(String.valueOf(literal))) {
				return Optional.of(ImmutableSet.of(element));
			}
		}
		return Optional.empty();
	}

	/**
	 * @return The elements of the universe absent from the value.
	 */
	public ImmutableSet<E> complement(ImmutableSet<E> value) {
		return Sets.difference(this.universe, value).immutableCopy();
	}

	@Override
	public ImmutableSet<E> top() {
		return this.universe;
	}

	@Override
	public ImmutableSet<E> bottom() {
		return ImmutableSet.of();
	}

	@Override
	public boolean isEmpty(ImmutableSet<E> value) {
		return value.isEmpty();
	}

	@Override
	public boolean le(ImmutableSet<E> a, ImmutableSet<E> b) {
		return b.containsAll(a);
	}

	@Override
	public ImmutableSet<E> join(ImmutableSet<E> a, ImmutableSet<E> b) {
		return Sets.union(a, b).immutableCopy();
	}

	@Override
	public ImmutableSet<E> meet(ImmutableSet<E> a, ImmutableSet<E> b) {
		return Sets.intersection(a, b).immutableCopy();
	}

	@Override
	public ImmutableSet<E> widen(ImmutableSet<E> previous, ImmutableSet<E> next) {
		return join(previous, next);
	}

	@Override
	public boolean isSingleton(ImmutableSet<E> value) {
		return value.size() == 1;
	}

	@Override
	public String toString() {
		return this.name + this.universe;
	}
}
