package absint.cfg;

import absint.ir.PrettyPrinter;
import absint.util.Log;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a control flow graph in the DOT language.
 *
 * Each node is labelled with its name and its statement, followed by any
 * annotations (highlighted in red).
 */
public final class DotPrinter {
	private static final Escaper ESCAPER = HtmlEscapers.htmlEscaper();

	private final ControlFlowGraph cfg;
	private final ListMultimap<CfgNode, String> annotations = LinkedListMultimap.create();

	private DotPrinter(ControlFlowGraph cfg) {
		this.cfg = cfg;
	}

	public static DotPrinter of(ControlFlowGraph cfg) {
		return new DotPrinter(cfg);
	}

	/**
	 * Add a line of text to a node's label.
	 */
	public DotPrinter annotate(CfgNode node, String text) {
		if (!this.annotations.containsEntry(node, text)) {
			this.annotations.put(node, text);
		}
		return this;
	}

	/**
	 * Annotate every node of a path.
	 */
	public DotPrinter annotate(Iterable<CfgNode> path, String text) {
		for (var node : path) {
			annotate(node, text);
		}
		return this;
	}

	/**
	 * @return The graph in DOT syntax.
	 */
	public String print() {
		var ret = new StringBuilder();
		ret.append("digraph \"")
			.append(quote(this.cfg.getProgram().getName()))
			.append("\" {\n");
		ret.append("\tnode [shape=box];\n");

		for (var node : this.cfg.nodes()) {
			ret.append("\t\"")
				.append(quote(node.getName()))
				.append("\" [label=<")
				.append(label(node))
				.append(">];\n");
		}

		for (var edge : this.cfg.edges()) {
			ret.append("\t\"")
				.append(quote(edge.source().getName()))
				.append("\" -> \"")
				.append(quote(edge.target().getName()))
				.append("\";\n");
		}

		return ret.append("}\n").toString();
	}

	private String label(CfgNode node) {
		var ret = new StringBuilder();
		ret.append("<b>").append(ESCAPER.escape(node.getName())).append("</b>");

		node.getStmt().ifPresent(stmt -> ret.append("<br/><i>")
			.append(ESCAPER.escape(PrettyPrinter.print(stmt).replace('\n', ' ')))
			.append("</i>"));

		for (var text : this.annotations.get(node)) {
			ret.append("<br/><font color=\"red\">")
				.append(ESCAPER.escape(text))
				.append("</font>");
		}
		return ret.toString();
	}

	private static String quote(String id) {
		return id.replace("\\", "\\\\").replace("\"", "\\\"");
	}

	/**
	 * Write the graph to a file.
	 */
	public void write(Path path) throws IOException {
		Files.writeString(path, print(), StandardCharsets.UTF_8);
		Log.info("Wrote %s", path);
	}
}
