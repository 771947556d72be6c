package absint.types;

import absint.dataflow.Domain;
import absint.dataflow.OperationProvider;

import java.util.Objects;

/**
 * How values of a type are abstracted: the domain, the semantics of the
 * operators over it and the literal builder.
 */
public record TypeInterpretation(Domain<?> domain, OperationProvider operations, LiteralBuilder builder) {
	public TypeInterpretation {
		Objects.requireNonNull(domain);
		Objects.requireNonNull(operations);
		Objects.requireNonNull(builder);
	}
}
