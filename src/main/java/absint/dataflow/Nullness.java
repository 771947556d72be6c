package absint.dataflow;

/**
 * The concrete values a pointer is abstracted to.
 */
public enum Nullness {
	NULL,
	NON_NULL;

	@Override
	public String toString() {
		return this == NULL ? "null" : "non-null";
	}
}
