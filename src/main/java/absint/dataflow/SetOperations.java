package absint.dataflow;

import absint.dataflow.Operation.Preimage;
import absint.ir.Operator;

import com.google.common.collect.ImmutableSet;

import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Operator semantics over a {@link FiniteSetDomain}, computed by enumerating
 * the (finite) concrete values.  Both directions are exact.
 */
public final class SetOperations<E> implements OperationProvider {
	private final FiniteSetDomain<E> domain;

	public SetOperations(FiniteSetDomain<E> domain) {
		this.domain = domain;
	}

	@Override
	public Optional<Operation> lookup(Operator op, Signature sig) {
		if (op == Operator.EQ || op == Operator.NEQ) {
			if (sig.arity() == 2 && sig.operand(0) == this.domain && sig.operand(1) == this.domain
				&& sig.result() == Domains.BOOLEAN) {
				var negate = op == Operator.NEQ;
				return Optional.of(relation((E x, E y) -> Set.of(x.equals(y) != negate)));
			}
			return Optional.empty();
		}

		if (this.domain != Domains.BOOLEAN || !sig.is(Domains.BOOLEAN, Domains.BOOLEAN)) {
			return Optional.empty();
		}

		switch (op) {
		case NOT:
			return Optional.of(function((Boolean x) -> Set.of(!x)));
		case AND:
			return Optional.of(relation((Boolean x, Boolean y) -> Set.of(x && y)));
		case OR:
			return Optional.of(relation((Boolean x, Boolean y) -> Set.of(x || y)));
		default:
			return Optional.empty();
		}
	}

	/**
	 * @return The operation whose concrete semantics maps each operand to a set of results.
	 */
	public static <X, R> Operation function(Function<X, Set<R>> f) {
		return Operation.<ImmutableSet<X>, ImmutableSet<R>>unary(
			a -> image(a, f),
			(expected, a) -> preimage(expected, a, f));
	}

	/**
	 * @return The operation whose concrete semantics maps each operand pair to a set of results.
	 */
	public static <X, Y, R> Operation relation(BiFunction<X, Y, Set<R>> f) {
		return Operation.<ImmutableSet<X>, ImmutableSet<Y>, ImmutableSet<R>>binary(
			(a, b) -> image(a, b, f),
			(expected, a, b) -> preimage(expected, a, b, f));
	}

	static <X, R> ImmutableSet<R> image(Set<X> a, Function<X, Set<R>> f) {
		var ret = ImmutableSet.<R>builder();
		for (var x : a) {
			ret.addAll(f.apply(x));
		}
		return ret.build();
	}

	static <X, Y, R> ImmutableSet<R> image(Set<X> a, Set<Y> b, BiFunction<X, Y, Set<R>> f) {
		var ret = ImmutableSet.<R>builder();
		for (var x : a) {
			for (var y : b) {
				ret.addAll(f.apply(x, y));
			}
		}
		return ret.build();
	}

	private static <R> boolean intersects(Set<R> expected, Set<R> results) {
		for (var r : results) {
			if (expected.contains(r)) {
				return true;
			}
		}
		return false;
	}

	static <X, R> Optional<ImmutableSet<X>> preimage(Set<R> expected, ImmutableSet<X> a, Function<X, Set<R>> f) {
		var ret = ImmutableSet.<X>builder();
		for (var x : a) {
			if (intersects(expected, f.apply(x))) {
				ret.add(x);
			}
		}

		var set = ret.build();
		return set.isEmpty() ? Optional.empty() : Optional.of(set);
	}

	static <X, Y, R> Optional<Preimage<ImmutableSet<X>, ImmutableSet<Y>>> preimage(
		Set<R> expected,
		ImmutableSet<X> a,
		ImmutableSet<Y> b,
		BiFunction<X, Y, Set<R>> f
	) {
		var lhs = ImmutableSet.<X>builder();
		var rhs = ImmutableSet.<Y>builder();
		for (var x : a) {
			for (var y : b) {
				if (intersects(expected, f.apply(x, y))) {
					lhs.add(x);
					rhs.add(y);
				}
			}
		}

		var lhsSet = lhs.build();
		var rhsSet = rhs.build();
		if (lhsSet.isEmpty() || rhsSet.isEmpty()) {
			return Optional.empty();
		} else {
			return Optional.of(new Preimage<>(lhsSet, rhsSet));
		}
	}
}
