package absint.types;

import java.util.Optional;

/**
 * Maps semantic types to their interpretation.
 */
@FunctionalInterface
public interface TypeInterpreter {
	/**
	 * @return The interpretation of the type, or nothing if unsupported.
	 */
	Optional<TypeInterpretation> fromType(Type type);

	/**
	 * @return An interpreter that tries this one first, then the other.
	 */
	default TypeInterpreter or(TypeInterpreter other) {
		return type -> {
			var ret = fromType(type);
			if (ret.isPresent()) {
				return ret;
			} else {
				return other.fromType(type);
			}
		};
	}
}
