package absint.checkers;

import absint.ir.Program;
import absint.model.Model;
import absint.semantics.AbstractSemantics;
import absint.semantics.AnalysisResult;
import absint.semantics.MergePredicate;

/**
 * Looks for runtime errors using the results of the abstract semantics.
 */
public interface Checker {
	/**
	 * @return The checker's short name.
	 */
	String getName();

	/**
	 * @return What the checker reports.
	 */
	String getDescription();

	/**
	 * Check an analyzed program.
	 */
	CheckerResults check(AnalysisResult analysis);

	/**
	 * Analyze a program, then check it.
	 */
	default CheckerResults check(Program program, Model model, MergePredicate merge) {
		return check(AbstractSemantics.compute(program, model, merge));
	}
}
