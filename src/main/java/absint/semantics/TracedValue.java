package absint.semantics;

/**
 * The value of an expression along one trace.
 */
public record TracedValue(Trace trace, Object value) {
}
