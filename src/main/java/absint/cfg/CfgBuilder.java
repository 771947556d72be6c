package absint.cfg;

import absint.ConfigurationException;
import absint.ir.Assign;
import absint.ir.Assume;
import absint.ir.Loop;
import absint.ir.Program;
import absint.ir.Read;
import absint.ir.Split;
import absint.ir.Stmt;
import absint.ir.Use;
import absint.util.Log;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.ImmutableGraph;
import com.google.common.graph.MutableGraph;

import java.util.List;

/**
 * Lowers a structured program into a {@link ControlFlowGraph}.
 *
 * <ul>
 * <li>statements of a sequence are chained</li>
 * <li>a split lowers both branches from the same node and rejoins them at a
 * {@code split_join} node</li>
 * <li>a loop gets a {@code loop_start} widening point with a back edge from
 * the end of its body, followed by a {@code loop_join} exit node</li>
 * </ul>
 */
public final class CfgBuilder {
	private final MutableGraph<CfgNode> graph = GraphBuilder.directed()
		.allowsSelfLoops(true)
		.nodeOrder(ElementOrder.insertion())
		.incidentEdgeOrder(ElementOrder.stable())
		.build();
	private final Multiset<String> counter = HashMultiset.create();

	private CfgBuilder() {
	}

	/**
	 * Build the control flow graph of a program.
	 *
	 * @throws ConfigurationException
	 *         If the program contains a statement that cannot be lowered.
	 */
	public static ControlFlowGraph build(Program program) {
		var builder = new CfgBuilder();
		var start = builder.node("start", null, false);
		builder.graph.addNode(start);
		builder.lower(program.getStmts(), start);

		var cfg = new ControlFlowGraph(program, ImmutableGraph.copyOf(builder.graph), start);
		Log.debug("Built %s", cfg);
		return cfg;
	}

	private CfgNode node(String kind, Stmt stmt, boolean wideningPoint) {
		var index = this.counter.add(kind, 1);
		return new CfgNode(kind + index, stmt, wideningPoint);
	}

	private void link(CfgNode from, CfgNode to) {
		this.graph.putEdge(from, to);
	}

	private CfgNode lower(List<Stmt> stmts, CfgNode cur) {
		for (var stmt : stmts) {
			cur = lower(stmt, cur);
		}
		return cur;
	}

	private CfgNode lower(Stmt stmt, CfgNode cur) {
		if (stmt instanceof Assign) {
			return atomic("assign", stmt, cur);
		} else if (stmt instanceof Read) {
			return atomic("read", stmt, cur);
		} else if (stmt instanceof Use) {
			return atomic("use", stmt, cur);
		} else if (stmt instanceof Assume) {
			return atomic("assume", stmt, cur);
		} else if (stmt instanceof Split split) {
			var endFirst = lower(split.getFirst(), cur);
			var endSecond = lower(split.getSecond(), cur);
			var join = node("split_join", null, false);
			this.graph.addNode(join);
			link(endFirst, join);
			link(endSecond, join);
			return join;
		} else if (stmt instanceof Loop loop) {
			var loopStart = node("loop_start", null, true);
			this.graph.addNode(loopStart);
			link(cur, loopStart);
			var end = lower(loop.getBody(), loopStart);
			link(end, loopStart);
			var join = node("loop_join", null, false);
			link(loopStart, join);
			return join;
		} else {
			throw new ConfigurationException("Cannot lower statement '%s'", stmt);
		}
	}

	private CfgNode atomic(String kind, Stmt stmt, CfgNode cur) {
		var node = node(kind, stmt, false);
		link(cur, node);
		return node;
	}
}
