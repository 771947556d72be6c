package absint.dataflow;

import absint.ir.Operator;

import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Operator semantics over a pointer nullness domain.
 */
public final class AccessOperations implements OperationProvider {
	private static final ImmutableSet<Nullness> NON_NULL = ImmutableSet.of(Nullness.NON_NULL);

	private final FiniteSetDomain<Nullness> domain;

	public AccessOperations(FiniteSetDomain<Nullness> domain) {
		this.domain = domain;
	}

	@Override
	public Optional<Operation> lookup(Operator op, Signature sig) {
		switch (op) {
		case EQ:
		case NEQ:
			if (sig.arity() == 2 && sig.operand(0) == this.domain && sig.operand(1) == this.domain
				&& sig.result() == Domains.BOOLEAN) {
				return Optional.of(SetOperations.relation((Nullness x, Nullness y) -> equality(op, x, y)));
			}
			return Optional.empty();

		case DEREF:
			if (sig.arity() == 1 && sig.operand(0) == this.domain) {
				return Optional.of(deref(sig.result()));
			}
			return Optional.empty();

		case ADDRESS:
			if (sig.arity() == 1 && sig.result() == this.domain) {
				return Optional.of(address(sig.operand(0)));
			}
			return Optional.empty();

		default:
			return Optional.empty();
		}
	}

	/**
	 * Two non-null pointers may or may not designate the same object.
	 */
	private static Set<Boolean> equality(Operator op, Nullness x, Nullness y) {
		Set<Boolean> eq;
		if (x != y) {
			eq = Domains.FALSE;
		} else if (x == Nullness.NULL) {
			eq = Domains.TRUE;
		} else {
			eq = Domains.BOTH;
		}

		if (op == Operator.NEQ) {
			return Domains.bool(eq.contains(false), eq.contains(true));
		}
		return eq;
	}

	/**
	 * Dereferencing yields any value of the designated type, provided the
	 * pointer may be non-null.
	 */
	@SuppressWarnings("unchecked")
	private static Operation deref(Domain<?> result) {
		var target = (Domain<Object>) result;
		return new Operation(
			args -> {
				var ptr = (ImmutableSet<Nullness>) args.get(0);
				return ptr.contains(Nullness.NON_NULL) ? target.top() : target.bottom();
			},
			(expected, args) -> {
				var ptr = (ImmutableSet<Nullness>) args.get(0);
				if (target.isEmpty(expected) || !ptr.contains(Nullness.NON_NULL)) {
					return Optional.empty();
				}
				return Optional.of(List.<Object>of(NON_NULL));
			});
	}

	/**
	 * Taking an address always yields a non-null pointer.
	 */
	@SuppressWarnings("unchecked")
	private static Operation address(Domain<?> operand) {
		var source = (Domain<Object>) operand;
		return new Operation(
			args -> source.isEmpty(args.get(0)) ? ImmutableSet.<Nullness>of() : NON_NULL,
			(expected, args) -> {
				var ptr = (ImmutableSet<Nullness>) expected;
				if (!ptr.contains(Nullness.NON_NULL) || source.isEmpty(args.get(0))) {
					return Optional.empty();
				}
				return Optional.of(List.of(args.get(0)));
			});
	}
}
