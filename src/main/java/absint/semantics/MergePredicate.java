package absint.semantics;

import absint.AnalysisConfig;
import absint.ConfigurationException;
import absint.cfg.CfgNode;

/**
 * Decides whether two traces reaching the same node are folded into one.
 *
 * Folded traces keep the nodes of both (see {@link Trace#union}) and the
 * join of their environments.  Traces that are never folded stay separate
 * partitions of the analysis result.
 */
@FunctionalInterface
public interface MergePredicate {
	/**
	 * @return Whether the two (trace, environment) pairs reaching {@code at}
	 *         should be merged.
	 */
	boolean shouldMerge(CfgNode at, Trace a, Env envA, Trace b, Env envB);

	/**
	 * @return A predicate that merges when either one does.
	 */
	default MergePredicate or(MergePredicate other) {
		return (at, a, envA, b, envB) -> shouldMerge(at, a, envA, b, envB)
			|| other.shouldMerge(at, a, envA, b, envB);
	}

	/**
	 * @return A predicate that merges when both do.
	 */
	default MergePredicate and(MergePredicate other) {
		return (at, a, envA, b, envB) -> shouldMerge(at, a, envA, b, envB)
			&& other.shouldMerge(at, a, envA, b, envB);
	}

	/**
	 * Fold everything: a trace-insensitive analysis.
	 */
	static MergePredicate always() {
		return (at, a, envA, b, envB) -> true;
	}

	/**
	 * Never fold distinct traces.
	 */
	static MergePredicate never() {
		return (at, a, envA, b, envB) -> false;
	}

	/**
	 * Fold traces that reach the node with identical environments.
	 */
	static MergePredicate equalEnvironments() {
		return (at, a, envA, b, envB) -> envA.equals(envB);
	}

	/**
	 * Fold a trace into another that visited all of its nodes.
	 */
	static MergePredicate subsumedTraces() {
		return (at, a, envA, b, envB) -> a.isSubsetOf(b) || b.isSubsetOf(a);
	}

	/**
	 * Fold traces once either is longer than the bound.
	 */
	static MergePredicate longerThan(int length) {
		return (at, a, envA, b, envB) -> a.size() > length || b.size() > length;
	}

	/**
	 * @return The built-in predicate with the given name.
	 */
	static MergePredicate named(String name) {
		switch (name) {
		case "always":
			return always();
		case "never":
			return never();
		case "equal-env":
			return equalEnvironments();
		case "subsumed":
			return subsumedTraces();
		default:
			throw new ConfigurationException("Unknown merge policy '%s'", name);
		}
	}

	/**
	 * @return The predicate selected by $ABSINT_MERGE_POLICY, bounded by $ABSINT_MAX_TRACE.
	 */
	static MergePredicate fromConfig() {
		return named(AnalysisConfig.MERGE_POLICY)
			.or(longerThan(AnalysisConfig.MAX_TRACE));
	}
}
