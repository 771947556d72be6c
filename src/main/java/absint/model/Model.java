package absint.model;

import absint.ConfigurationException;
import absint.dataflow.Domain;
import absint.dataflow.Operation;
import absint.ir.IrNode;
import absint.types.LiteralBuilder;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The model of one or more programs: the meaning of every typed node.
 * Nodes are keyed by identity.
 */
public final class Model {
	private final Map<IrNode, ModelEntry> entries;

	Model(IdentityHashMap<IrNode, ModelEntry> entries) {
		this.entries = Collections.unmodifiableMap(entries);
	}

	/**
	 * @return The entry of a node, if it has one.
	 */
	public Optional<ModelEntry> find(IrNode node) {
		return Optional.ofNullable(this.entries.get(node));
	}

	/**
	 * @return The entry of a node.
	 * @throws ConfigurationException
	 *         If the node was not typed when the model was built.
	 */
	public ModelEntry get(IrNode node) {
		var entry = this.entries.get(node);
		if (entry == null) {
			throw new ConfigurationException("No model for '%s'", node);
		}
		return entry;
	}

	/**
	 * @return The domain of a node's values.
	 */
	public Domain<Object> domain(IrNode node) {
		return get(node).getObjectDomain();
	}

	/**
	 * @return The operation of an operator node.
	 */
	public Operation operation(IrNode node) {
		return get(node).requireOperation(node);
	}

	/**
	 * @return The builder of a literal node.
	 */
	public LiteralBuilder builder(IrNode node) {
		return get(node).requireBuilder(node);
	}

	public boolean contains(IrNode node) {
		return this.entries.containsKey(node);
	}

	/**
	 * @return The number of modelled nodes.
	 */
	public int size() {
		return this.entries.size();
	}
}
