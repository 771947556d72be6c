package absint.dataflow;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The forward and inverse semantics of an operator over given domains.
 */
public record Operation(Definition definition, Inverse inverse) {
	public Operation {
		Objects.requireNonNull(definition);
		Objects.requireNonNull(inverse);
	}

	/**
	 * Forward semantics: the abstract result of applying the operator.
	 */
	@FunctionalInterface
	public interface Definition {
		Object apply(List<Object> operands);
	}

	/**
	 * Inverse semantics: given the expected result and the current operand
	 * values, the operand values that may produce it, or nothing if no
	 * operand values can.  The result may over-approximate the exact
	 * pre-image but must contain it.
	 */
	@FunctionalInterface
	public interface Inverse {
		Optional<List<Object>> apply(Object expected, List<Object> operands);
	}

	@FunctionalInterface
	public interface UnaryInverse<A, R> {
		Optional<A> apply(R expected, A operand);
	}

	@FunctionalInterface
	public interface BinaryInverse<A, B, R> {
		Optional<Preimage<A, B>> apply(R expected, A lhs, B rhs);
	}

	/**
	 * The operand values of a binary inverse.
	 */
	public record Preimage<A, B>(A lhs, B rhs) {
	}

	/**
	 * Build an operation from typed unary semantics.
	 */
	@SuppressWarnings("unchecked")
	public static <A, R> Operation unary(Function<A, R> forward, UnaryInverse<A, R> inverse) {
		return new Operation(
			args -> forward.apply((A) args.get(0)),
			(expected, args) -> inverse.apply((R) expected, (A) args.get(0))
				.map(a -> List.<Object>of(a)));
	}

	/**
	 * Build an operation from typed binary semantics.
	 */
	@SuppressWarnings("unchecked")
	public static <A, B, R> Operation binary(BiFunction<A, B, R> forward, BinaryInverse<A, B, R> inverse) {
		return new Operation(
			args -> forward.apply((A) args.get(0), (B) args.get(1)),
			(expected, args) -> inverse.apply((R) expected, (A) args.get(0), (B) args.get(1))
				.map(p -> Arrays.<Object>asList(p.lhs(), p.rhs())));
	}
}
