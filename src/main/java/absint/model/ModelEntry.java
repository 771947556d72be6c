package absint.model;

import absint.ConfigurationException;
import absint.dataflow.Domain;
import absint.dataflow.Operation;
import absint.types.LiteralBuilder;

import java.util.Objects;
import java.util.Optional;

/**
 * What the model knows about one typed IR node.
 *
 * Operators carry their operation, literals their builder, identifiers only
 * their domain.
 */
public final class ModelEntry {
	private final Domain<?> domain;
	private final Operation operation;
	private final LiteralBuilder builder;

	private ModelEntry(Domain<?> domain, Operation operation, LiteralBuilder builder) {
		this.domain = Objects.requireNonNull(domain);
		this.operation = operation;
		this.builder = builder;
	}

	static ModelEntry ofIdent(Domain<?> domain) {
		return new ModelEntry(domain, null, null);
	}

	static ModelEntry ofOperation(Domain<?> domain, Operation operation) {
		return new ModelEntry(domain, Objects.requireNonNull(operation), null);
	}

	static ModelEntry ofLiteral(Domain<?> domain, LiteralBuilder builder) {
		return new ModelEntry(domain, null, Objects.requireNonNull(builder));
	}

	/**
	 * @return The domain of the values computed by the node.
	 */
	public Domain<?> getDomain() {
		return this.domain;
	}

	/**
	 * @return The domain, for callers that handle values opaquely.
	 */
	@SuppressWarnings("unchecked")
	public Domain<Object> getObjectDomain() {
		return (Domain<Object>) this.domain;
	}

	public Optional<Operation> getOperation() {
		return Optional.ofNullable(this.operation);
	}

	public Optional<LiteralBuilder> getBuilder() {
		return Optional.ofNullable(this.builder);
	}

	/**
	 * @return The operation of an operator node.
	 */
	Operation requireOperation(Object node) {
		if (this.operation == null) {
			throw new ConfigurationException("No operation for '%s'", node);
		}
		return this.operation;
	}

	/**
	 * @return The builder of a literal node.
	 */
	LiteralBuilder requireBuilder(Object node) {
		if (this.builder == null) {
			throw new ConfigurationException("No literal builder for '%s'", node);
		}
		return this.builder;
	}

	@Override
	public String toString() {
		var ret = new StringBuilder("{domain: ").append(this.domain);
		if (this.operation != null) {
			ret.append(", operation");
		}
		if (this.builder != null) {
			ret.append(", builder");
		}
		return ret.append("}").toString();
	}
}
