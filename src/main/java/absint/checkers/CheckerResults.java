package absint.checkers;

import absint.AnalysisConfig;
import absint.cfg.DotPrinter;
import absint.semantics.AnalysisResult;

import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * The diagnostics of one checker on one analyzed program.
 */
public final class CheckerResults {
	private final String checker;
	private final AnalysisResult analysis;
	private final ImmutableList<Diagnostic> diagnostics;

	CheckerResults(String checker, AnalysisResult analysis, ImmutableList<Diagnostic> diagnostics) {
		this.checker = checker;
		this.analysis = analysis;
		this.diagnostics = diagnostics;
	}

	public String getChecker() {
		return this.checker;
	}

	public AnalysisResult getAnalysis() {
		return this.analysis;
	}

	public ImmutableList<Diagnostic> getDiagnostics() {
		return this.diagnostics;
	}

	public boolean isEmpty() {
		return this.diagnostics.isEmpty();
	}

	/**
	 * @return The control flow graph with every node on a path to an error
	 *         annotated, in DOT syntax.
	 */
	public String toDot() {
		return printer().print();
	}

	private DotPrinter printer() {
		var ret = DotPrinter.of(this.analysis.getCfg());
		for (var diag : this.diagnostics) {
			ret.annotate(diag.getTrace(), diag.getPathDescription());
		}
		return ret;
	}

	/**
	 * Write the annotated control flow graph to a DOT file.
	 */
	public void saveResultsToFile(Path path) throws IOException {
		printer().write(path);
	}

	/**
	 * Write the annotated control flow graph to $ABSINT_DOT_DIR/{program}.{checker}.dot.
	 *
	 * @return The path written.
	 */
	public Path saveResults() throws IOException {
		var name = this.analysis.getCfg().getProgram().getName() + "." + this.checker + ".dot";
		var path = Paths.get(AnalysisConfig.DOT_DIR, name);
		saveResultsToFile(path);
		return path;
	}
}
