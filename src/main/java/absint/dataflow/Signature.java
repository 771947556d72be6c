package absint.dataflow;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * The domains of an operation's operands and result.  Domains compare by
 * identity, so equal signatures mean literally the same domains.
 */
public record Signature(ImmutableList<Domain<?>> operands, Domain<?> result) {
	public Signature {
		Objects.requireNonNull(operands);
		Objects.requireNonNull(result);
	}

	public static Signature of(List<? extends Domain<?>> operands, Domain<?> result) {
		return new Signature(ImmutableList.copyOf(operands), result);
	}

	public static Signature unary(Domain<?> operand, Domain<?> result) {
		return new Signature(ImmutableList.of(operand), result);
	}

	public static Signature binary(Domain<?> lhs, Domain<?> rhs, Domain<?> result) {
		return new Signature(ImmutableList.of(lhs, rhs), result);
	}

	public int arity() {
		return this.operands.size();
	}

	public Domain<?> operand(int i) {
		return this.operands.get(i);
	}

	/**
	 * @return Whether every operand and the result are the given domains.
	 */
	public boolean is(Domain<?> operand, Domain<?> result) {
		return this.result == result
			&& this.operands.stream().allMatch(d -> d == operand);
	}

	@Override
	public String toString() {
		return this.operands + " -> " + this.result;
	}
}
