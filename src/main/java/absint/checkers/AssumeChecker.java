package absint.checkers;

import absint.ConfigurationException;
import absint.cfg.PurposeSite;
import absint.ir.Expr;
import absint.ir.PrettyPrinter;
import absint.ir.Purpose;
import absint.semantics.AnalysisResult;
import absint.semantics.Trace;
import absint.util.Log;

import com.google.common.collect.ImmutableList;

import java.util.Set;

/**
 * A checker for the assumptions a frontend inserts before risky operations.
 *
 * Every assume tagged with the checker's purpose kind is evaluated just
 * before it is asserted.  A trace where it may evaluate to false is a path
 * to an error; the finding is precise when it can only be false.
 */
abstract class AssumeChecker implements Checker {
	/**
	 * @return The kind of purpose this checker looks for.
	 */
	abstract Purpose.Kind kind();

	/**
	 * @return The diagnostic for a failing check.
	 */
	abstract Diagnostic diagnose(Trace trace, PurposeSite site, boolean precise);

	@Override
	public CheckerResults check(AnalysisResult analysis) {
		var diagnostics = ImmutableList.<Diagnostic>builder();

		for (var site : analysis.findAssumes(kind())) {
			var check = site.assume().getExpr();
			analysis.evalAt(site.node(), check).forEach(tv -> {
				var value = asBoolean(check, tv.value());
				if (value.contains(false)) {
					diagnostics.add(diagnose(tv.trace(), site, value.size() == 1));
				}
			});
		}

		var ret = new CheckerResults(getName(), analysis, diagnostics.build());
		Log.info("%s: %d finding(s) in %s", getName(), ret.getDiagnostics().size(),
			analysis.getCfg().getProgram().getName());
		return ret;
	}

	private static Set<?> asBoolean(Expr check, Object value) {
		if (value instanceof Set<?> set) {
			return set;
		}
		throw new ConfigurationException("Check '%s' is not boolean: %s", check, value);
	}

	/**
	 * @return How to name an expression in a report: its source text, if known.
	 */
	static String describe(Expr expr) {
		return expr.getData()
			.getOrigin()
			.map(Object::toString)
			.orElseGet(() -> PrettyPrinter.print(expr));
	}
}
