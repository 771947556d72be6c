package absint.checkers;

import absint.cfg.PurposeSite;
import absint.semantics.Trace;

import java.util.Objects;

/**
 * A path to a (potential) runtime error found by a checker.
 */
public final class Diagnostic {
	private final Trace trace;
	private final PurposeSite site;
	private final boolean precise;
	private final String message;
	private final String pathDescription;

	Diagnostic(Trace trace, PurposeSite site, boolean precise, String message, String pathDescription) {
		this.trace = Objects.requireNonNull(trace);
		this.site = Objects.requireNonNull(site);
		this.precise = precise;
		this.message = message;
		this.pathDescription = pathDescription;
	}

	/**
	 * @return The path leading to the error.
	 */
	public Trace getTrace() {
		return this.trace;
	}

	/**
	 * @return The check that fails.
	 */
	public PurposeSite getSite() {
		return this.site;
	}

	/**
	 * @return Whether the check always fails along the trace, rather than
	 *         possibly failing.
	 */
	public boolean isPrecise() {
		return this.precise;
	}

	/**
	 * @return The one-line report, e.g. "null dereference of 'p'".
	 */
	public String getMessage() {
		return this.message;
	}

	/**
	 * @return The annotation of the nodes of the trace in a DOT rendering.
	 */
	public String getPathDescription() {
		return this.pathDescription;
	}

	@Override
	public String toString() {
		return this.message + " along " + this.trace;
	}
}
