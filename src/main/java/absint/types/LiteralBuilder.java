package absint.types;

/**
 * Converts a literal's concrete representation into the abstract singleton
 * of its domain.
 */
@FunctionalInterface
public interface LiteralBuilder {
	/**
	 * @throws absint.ConfigurationException
	 *         If the literal is not a value of the domain.
	 */
	Object build(Object literal);
}
