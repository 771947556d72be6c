package absint.semantics;

import absint.cfg.CfgNode;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

import java.util.Iterator;
import java.util.stream.Collectors;

/**
 * The history of an execution path: the CFG nodes it went through, in order
 * of first visit.
 *
 * A node appears at most once, so revisiting a loop does not make traces
 * grow.  Two traces are equal when they visit the same nodes in the same
 * order.
 */
public final class Trace implements Iterable<CfgNode> {
	private static final Trace EMPTY = new Trace(ImmutableSet.of());

	private final ImmutableSet<CfgNode> nodes;

	private Trace(ImmutableSet<CfgNode> nodes) {
		this.nodes = nodes;
	}

	public static Trace empty() {
		return EMPTY;
	}

	public static Trace of(CfgNode... nodes) {
		return new Trace(ImmutableSet.copyOf(nodes));
	}

	/**
	 * @return This trace extended with a node (unchanged if already visited).
	 */
	public Trace append(CfgNode node) {
		if (this.nodes.contains(node)) {
			return this;
		}
		return new Trace(ImmutableSet.<CfgNode>builder()
			.addAll(this.nodes)
			.add(node)
			.build());
	}

	/**
	 * @return The nodes of both traces, this one's first.
	 */
	public Trace union(Trace other) {
		if (other.isSubsetOf(this)) {
			return this;
		}
		return new Trace(ImmutableSet.<CfgNode>builder()
			.addAll(this.nodes)
			.addAll(other.nodes)
			.build());
	}

	public boolean contains(CfgNode node) {
		return this.nodes.contains(node);
	}

	/**
	 * @return Whether every node of this trace is in the other one, in any order.
	 */
	public boolean isSubsetOf(Trace other) {
		return other.nodes.containsAll(this.nodes);
	}

	public int size() {
		return this.nodes.size();
	}

	public boolean isEmpty() {
		return this.nodes.isEmpty();
	}

	/**
	 * @return The most recently visited node.
	 */
	public CfgNode last() {
		return Iterables.getLast(this.nodes);
	}

	public ImmutableSet<CfgNode> nodes() {
		return this.nodes;
	}

	@Override
	public Iterator<CfgNode> iterator() {
		return this.nodes.iterator();
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj instanceof Trace other) {
			return this.nodes.asList().equals(other.nodes.asList());
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return this.nodes.asList().hashCode();
	}

	@Override
	public String toString() {
		return this.nodes.stream()
			.map(CfgNode::getName)
			.collect(Collectors.joining(", ", "[", "]"));
	}
}
