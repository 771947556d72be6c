package absint.semantics;

import absint.AnalysisConfig;
import absint.ConfigurationException;
import absint.cfg.CfgBuilder;
import absint.cfg.CfgNode;
import absint.cfg.ControlFlowGraph;
import absint.ir.Assign;
import absint.ir.Assume;
import absint.ir.Program;
import absint.ir.Read;
import absint.ir.Use;
import absint.model.Model;
import absint.util.Log;
import absint.util.WorkList;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The trace-sensitive fixpoint computation over a control flow graph.
 *
 * Each node stores, for every trace reaching it, the environment after its
 * statement.  A node is recomputed from the states of its predecessors
 * whenever one of them changes, until nothing changes.  Widening points
 * widen their new states by the old ones, which bounds the number of visits.
 */
public final class AbstractSemantics {
	private final ControlFlowGraph cfg;
	private final Model model;
	private final MergePredicate merge;
	private final ExprEvaluator evaluator;
	private final ExprSolver solver;

	private final Map<CfgNode, Map<Trace, Env>> states = new LinkedHashMap<>();
	private final Multiset<CfgNode> visits = HashMultiset.create();

	private AbstractSemantics(ControlFlowGraph cfg, Model model, MergePredicate merge) {
		this.cfg = cfg;
		this.model = model;
		this.merge = merge;
		this.evaluator = new ExprEvaluator(model);
		this.solver = new ExprSolver(model);
	}

	/**
	 * Analyze a program, starting with every variable at top.
	 */
	public static AnalysisResult compute(Program program, Model model, MergePredicate merge) {
		return compute(CfgBuilder.build(program), model, merge, Env.empty());
	}

	/**
	 * Analyze a program, starting from the given environment.  Variables it
	 * does not bind start at top.
	 */
	public static AnalysisResult compute(ControlFlowGraph cfg, Model model, MergePredicate merge, Env initial) {
		var semantics = new AbstractSemantics(cfg, model, merge);
		return semantics.run(semantics.initialEnv(initial));
	}

	private Env initialEnv(Env initial) {
		var values = new LinkedHashMap<>(initial.asMap());
		for (var ident : this.cfg.getProgram().variables()) {
			// Untyped variables are never evaluated
			if (!values.containsKey(ident) && this.model.contains(ident)) {
				values.put(ident, this.model.domain(ident).top());
			}
		}
		return Env.of(values);
	}

	private AnalysisResult run(Env initial) {
		var entry = this.cfg.getEntry();
		Log.debug("Analyzing %s", this.cfg);

		this.states.put(entry, ImmutableMap.of(Trace.of(entry), initial));
		this.visits.add(entry);

		var workList = new WorkList<CfgNode>();
		workList.addAllLast(this.cfg.successors(entry));

		while (!workList.isEmpty()) {
			var node = workList.removeFirst();
			this.visits.add(node);

			if (update(node)) {
				workList.addAllLast(this.cfg.successors(node));
			}
		}

		Log.debug("Fixpoint of %s reached after %d visits", this.cfg.getProgram().getName(), this.visits.size());
		return new AnalysisResult(this.cfg, this.model, this.states, this.visits);
	}

	/**
	 * Recompute a node's states.
	 *
	 * @return Whether they changed.
	 */
	private boolean update(CfgNode node) {
		var candidates = new ArrayList<Map.Entry<Trace, Env>>();
		for (var pred : this.cfg.predecessors(node)) {
			for (var e : this.states.getOrDefault(pred, Map.of()).entrySet()) {
				var post = transfer(node, e.getValue());
				if (post.isPresent()) {
					candidates.add(Map.entry(e.getKey().append(node), post.get()));
				} else {
					Log.trace("%s: infeasible along %s", node, e.getKey());
				}
			}
		}

		var next = merge(node, candidates);
		var prev = this.states.get(node);
		if (node.isWideningPoint() && prev != null) {
			next = widen(prev, next);
		}

		if (AnalysisConfig.TRACE_FIXPOINT) {
			Log.trace("%s: %s", node, next);
		}

		if (prev == null) {
			this.states.put(node, next);
			return !next.isEmpty();
		} else if (prev.equals(next)) {
			return false;
		} else {
			this.states.put(node, next);
			return true;
		}
	}

	/**
	 * Apply a node's statement to an environment.
	 *
	 * @return The resulting environment, or nothing if the node cannot be
	 *         reached from this one.
	 */
	private Optional<Env> transfer(CfgNode node, Env env) {
		var stmt = node.getStmt().orElse(null);
		if (stmt == null || stmt instanceof Use) {
			return Optional.of(env);
		} else if (stmt instanceof Assign assign) {
			var value = this.evaluator.eval(assign.getExpr(), env);
			return Optional.of(env.with(assign.getTarget(), value));
		} else if (stmt instanceof Read read) {
			var top = this.model.domain(read.getTarget()).top();
			return Optional.of(env.with(read.getTarget(), top));
		} else if (stmt instanceof Assume assume) {
			return this.solver.solve(assume.getExpr(), env);
		} else {
			throw new ConfigurationException("No transfer function for '%s'", stmt);
		}
	}

	/**
	 * Group the incoming (trace, environment) pairs with the merge predicate.
	 */
	private Map<Trace, Env> merge(CfgNode node, List<Map.Entry<Trace, Env>> candidates) {
		var groups = new ArrayList<Map.Entry<Trace, Env>>();
		for (var candidate : candidates) {
			var merged = false;
			for (int i = 0; i < groups.size(); ++i) {
				var group = groups.get(i);
				if (group.getKey().equals(candidate.getKey())
					|| this.merge.shouldMerge(node, group.getKey(), group.getValue(), candidate.getKey(), candidate.getValue())) {
					groups.set(i, Map.entry(
						group.getKey().union(candidate.getKey()),
						group.getValue().join(candidate.getValue(), this.model)));
					merged = true;
					break;
				}
			}
			if (!merged) {
				groups.add(candidate);
			}
		}

		// Unions may have produced the same trace twice
		var ret = new LinkedHashMap<Trace, Env>();
		for (var group : groups) {
			ret.merge(group.getKey(), group.getValue(), (a, b) -> a.join(b, this.model));
		}
		return ret;
	}

	/**
	 * Widen each new state by the old states of the traces it extends.
	 */
	private Map<Trace, Env> widen(Map<Trace, Env> prev, Map<Trace, Env> next) {
		var ret = new LinkedHashMap<Trace, Env>();
		for (var e : next.entrySet()) {
			var trace = e.getKey();
			Env old = null;
			for (var p : prev.entrySet()) {
				if (p.getKey().isSubsetOf(trace)) {
					old = old == null ? p.getValue() : old.join(p.getValue(), this.model);
				}
			}
			ret.put(trace, old == null ? e.getValue() : old.widen(e.getValue(), this.model));
		}
		return ret;
	}
}
