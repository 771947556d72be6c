package absint.dataflow;

import absint.ir.Operator;

import java.util.Optional;

/**
 * Looks up the semantics of an operator for a signature.
 */
@FunctionalInterface
public interface OperationProvider {
	/**
	 * @return The operation, or nothing if this provider does not define it.
	 */
	Optional<Operation> lookup(Operator op, Signature sig);

	/**
	 * @return A provider that asks this one, then the other.
	 */
	default OperationProvider or(OperationProvider other) {
		return (op, sig) -> {
			var ret = lookup(op, sig);
			if (ret.isPresent()) {
				return ret;
			} else {
				return other.lookup(op, sig);
			}
		};
	}

	/**
	 * @return A provider that defines nothing.
	 */
	static OperationProvider none() {
		return (op, sig) -> Optional.empty();
	}
}
