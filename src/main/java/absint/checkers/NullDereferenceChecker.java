package absint.checkers;

import absint.cfg.PurposeSite;
import absint.ir.Purpose;
import absint.semantics.Trace;

/**
 * Reports dereferences of pointers that may be null.
 */
public final class NullDereferenceChecker extends AssumeChecker {
	public static final NullDereferenceChecker INSTANCE = new NullDereferenceChecker();

	private NullDereferenceChecker() {
	}

	@Override
	public String getName() {
		return "null_dereference";
	}

	@Override
	public String getDescription() {
		return "Reports an access check when dereferencing a reference that could be null.";
	}

	@Override
	Purpose.Kind kind() {
		return Purpose.Kind.DEREF_CHECK;
	}

	@Override
	Diagnostic diagnose(Trace trace, PurposeSite site, boolean precise) {
		var derefed = describe(((Purpose.DerefCheck) site.purpose()).expr());
		var message = String.format(precise ? "null dereference of '%s'" : "(potential) null dereference of '%s'", derefed);
		var path = String.format("path to %snull dereference of %s", precise ? "" : "potential ", derefed);
		return new Diagnostic(trace, site, precise, message, path);
	}
}
