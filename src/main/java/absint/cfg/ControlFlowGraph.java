package absint.cfg;

import absint.ir.Assume;
import absint.ir.Program;
import absint.ir.Purpose;

import com.google.common.collect.ImmutableList;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.Graphs;
import com.google.common.graph.ImmutableGraph;

import java.util.Objects;
import java.util.Set;

/**
 * The control flow graph of a single program.
 *
 * Every node is reachable from the entry node.  The graph is immutable once
 * built; see {@link CfgBuilder}.
 */
public final class ControlFlowGraph {
	private final Program program;
	private final ImmutableGraph<CfgNode> graph;
	private final CfgNode entry;

	ControlFlowGraph(Program program, ImmutableGraph<CfgNode> graph, CfgNode entry) {
		this.program = Objects.requireNonNull(program);
		this.graph = graph;
		this.entry = entry;
	}

	/**
	 * @return The program this graph was built from.
	 */
	public Program getProgram() {
		return this.program;
	}

	/**
	 * @return The unique entry node.
	 */
	public CfgNode getEntry() {
		return this.entry;
	}

	/**
	 * @return Every node, in creation order.
	 */
	public Set<CfgNode> nodes() {
		return this.graph.nodes();
	}

	/**
	 * @return Every edge.
	 */
	public Set<EndpointPair<CfgNode>> edges() {
		return this.graph.edges();
	}

	public Set<CfgNode> successors(CfgNode node) {
		return this.graph.successors(node);
	}

	public Set<CfgNode> predecessors(CfgNode node) {
		return this.graph.predecessors(node);
	}

	/**
	 * @return Whether the graph has a cycle.
	 */
	public boolean hasCycle() {
		return Graphs.hasCycle(this.graph);
	}

	/**
	 * @return The nodes reachable from the given one (including itself).
	 */
	public Set<CfgNode> reachableFrom(CfgNode node) {
		return Graphs.reachableNodes(this.graph, node);
	}

	/**
	 * @return The node with the given name.
	 */
	public CfgNode node(String name) {
		for (var node : nodes()) {
			if (node.getName().equals(name)) {
				return node;
			}
		}
		throw new IllegalArgumentException("No node named " + name);
	}

	/**
	 * Find the assume nodes that carry a purpose of the given kind.
	 */
	public ImmutableList<PurposeSite> findAssumes(Purpose.Kind kind) {
		var ret = ImmutableList.<PurposeSite>builder();
		for (var node : nodes()) {
			var stmt = node.getStmt().orElse(null);
			if (stmt instanceof Assume assume && Purpose.isPurposeOf(kind, assume)) {
				ret.add(new PurposeSite(node, assume, assume.getData().getPurpose().get()));
			}
		}
		return ret.build();
	}

	@Override
	public String toString() {
		return String.format("CFG(%s, %d nodes, %d edges)",
			this.program.getName(), this.graph.nodes().size(), this.graph.edges().size());
	}
}
