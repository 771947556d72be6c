package absint.semantics;

import absint.cfg.CfgNode;
import absint.cfg.ControlFlowGraph;
import absint.cfg.PurposeSite;
import absint.ir.Expr;
import absint.ir.Purpose;
import absint.model.Model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The result of {@link AbstractSemantics}: for every node, the environment
 * after the node along each trace reaching it.  Immutable.
 */
public final class AnalysisResult {
	private final ControlFlowGraph cfg;
	private final Model model;
	private final ImmutableMap<CfgNode, ImmutableMap<Trace, Env>> states;
	private final ImmutableMultiset<CfgNode> visits;
	private final ExprEvaluator evaluator;

	AnalysisResult(ControlFlowGraph cfg, Model model, Map<CfgNode, Map<Trace, Env>> states, Multiset<CfgNode> visits) {
		this.cfg = cfg;
		this.model = model;

		var builder = ImmutableMap.<CfgNode, ImmutableMap<Trace, Env>>builder();
		for (var e : states.entrySet()) {
			builder.put(e.getKey(), ImmutableMap.copyOf(e.getValue()));
		}
		this.states = builder.build();
		this.visits = ImmutableMultiset.copyOf(visits);
		this.evaluator = new ExprEvaluator(model);
	}

	public ControlFlowGraph getCfg() {
		return this.cfg;
	}

	public Model getModel() {
		return this.model;
	}

	/**
	 * @return The environment after the node, per trace (empty if unreachable).
	 */
	public ImmutableMap<Trace, Env> getStates(CfgNode node) {
		return this.states.getOrDefault(node, ImmutableMap.of());
	}

	/**
	 * @return Whether any trace reaches the node.
	 */
	public boolean isReachable(CfgNode node) {
		return !getStates(node).isEmpty();
	}

	/**
	 * @return The join of the node's environments over all traces.
	 */
	public Optional<Env> getJoinedState(CfgNode node) {
		Env ret = null;
		for (var env : getStates(node).values()) {
			ret = ret == null ? env : ret.join(env, this.model);
		}
		return Optional.ofNullable(ret);
	}

	/**
	 * Evaluate an expression just before a node: once for every trace of every
	 * predecessor, the trace being extended with the node itself.
	 */
	public Stream<TracedValue> evalAt(CfgNode node, Expr expr) {
		return this.cfg.predecessors(node)
			.stream()
			.flatMap(pred -> getStates(pred).entrySet().stream())
			.map(e -> new TracedValue(e.getKey().append(node), this.evaluator.eval(expr, e.getValue())));
	}

	/**
	 * @return How many times the fixpoint computation processed the node.
	 */
	public int visits(CfgNode node) {
		return this.visits.count(node);
	}

	/**
	 * @return The total number of node visits.
	 */
	public int totalVisits() {
		return this.visits.size();
	}

	/**
	 * @return The assume nodes carrying a purpose of the given kind.
	 */
	public ImmutableList<PurposeSite> findAssumes(Purpose.Kind kind) {
		return this.cfg.findAssumes(kind);
	}
}
