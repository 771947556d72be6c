package absint.types;

import absint.ConfigurationException;
import absint.dataflow.AccessOperations;
import absint.dataflow.Domain;
import absint.dataflow.Domains;
import absint.dataflow.FiniteSetDomain;
import absint.dataflow.IntervalDomain;
import absint.dataflow.IntervalOperations;
import absint.dataflow.Nullness;
import absint.dataflow.SetOperations;

import com.google.common.collect.ImmutableSet;

import java.util.Optional;
import java.util.function.Function;

/**
 * Interprets the built-in types:
 *
 * <ul>
 * <li>booleans as subsets of {false, true}</li>
 * <li>integer ranges as intervals clamped to the range</li>
 * <li>enumerations as subsets of their literal names</li>
 * <li>pointers as subsets of {null, non-null}</li>
 * </ul>
 *
 * Every call creates fresh domains (except for booleans), so callers must
 * memoize interpretations per type.
 */
public final class DefaultTypeInterpreter implements TypeInterpreter {
	/** The literal denoting the null pointer. */
	public static final String NULL_LITERAL = "null";

	public static final DefaultTypeInterpreter INSTANCE = new DefaultTypeInterpreter();

	private DefaultTypeInterpreter() {
	}

	@Override
	public Optional<TypeInterpretation> fromType(Type type) {
		if (type instanceof Type.BooleanType) {
			return Optional.of(bool());
		} else if (type instanceof Type.IntRangeType range) {
			return Optional.of(intRange(range));
		} else if (type instanceof Type.EnumType enumType) {
			return Optional.of(enumeration(enumType));
		} else if (type instanceof Type.PointerType ptr) {
			return Optional.of(pointer(ptr));
		} else {
			return Optional.empty();
		}
	}

	private static TypeInterpretation bool() {
		var domain = Domains.BOOLEAN;
		return new TypeInterpretation(domain, new SetOperations<>(domain), builder(domain, domain::parse));
	}

	private static TypeInterpretation intRange(Type.IntRangeType range) {
		var domain = new IntervalDomain(range.min(), range.max());
		return new TypeInterpretation(domain, new IntervalOperations(domain), builder(domain, domain::parse));
	}

	private static TypeInterpretation enumeration(Type.EnumType type) {
		var domain = FiniteSetDomain.of(type.toString(), type.literals());
		return new TypeInterpretation(domain, new SetOperations<>(domain), builder(domain, domain::parse));
	}

	private static TypeInterpretation pointer(Type.PointerType type) {
		var domain = Domains.access(type.toString());
		var nullValue = ImmutableSet.of(Nullness.NULL);
		Function<Object, Optional<ImmutableSet<Nullness>>> parse = lit -> {
			if (lit == null || NULL_LITERAL.equals(lit)) {
				return Optional.of(nullValue);
			} else {
				return Optional.empty();
			}
		};
		return new TypeInterpretation(domain, new AccessOperations(domain), builder(domain, parse));
	}

	private static <T> LiteralBuilder builder(Domain<T> domain, Function<Object, Optional<T>> parse) {
		return literal -> parse.apply(literal)
			.orElseThrow(() -> new ConfigurationException("Literal '%s' is not a value of %s", literal, domain));
	}
}
