package absint.checkers;

import absint.cfg.PurposeSite;
import absint.ir.Purpose;
import absint.semantics.Trace;

/**
 * Reports accesses to record fields that may not exist under the current
 * value of their discriminant.
 */
public final class InvalidDiscriminantChecker extends AssumeChecker {
	public static final InvalidDiscriminantChecker INSTANCE = new InvalidDiscriminantChecker();

	private InvalidDiscriminantChecker() {
	}

	@Override
	public String getName() {
		return "invalid_discriminant";
	}

	@Override
	public String getDescription() {
		return "Reports a discriminant check when accessing a field that may not exist.";
	}

	@Override
	Purpose.Kind kind() {
		return Purpose.Kind.EXIST_CHECK;
	}

	@Override
	Diagnostic diagnose(Trace trace, PurposeSite site, boolean precise) {
		var check = (Purpose.ExistCheck) site.purpose();
		var prefix = describe(check.accessedExpr());
		var message = String.format(precise ? "invalid field '%s'" : "(potential) invalid field '%s'", check.fieldName());
		var path = String.format("path to %sinfeasible access %s.%s due to invalid condition on discriminant %s.%s",
			precise ? "" : "potential ", prefix, check.fieldName(), prefix, check.discrName());
		return new Diagnostic(trace, site, precise, message, path);
	}
}
