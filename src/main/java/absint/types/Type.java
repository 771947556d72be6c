package absint.types;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A semantic type, as produced by a {@link Typer} from a frontend type hint.
 * Types are values: equal types get the same interpretation.
 */
public sealed interface Type permits Type.BooleanType, Type.IntRangeType, Type.EnumType, Type.PointerType {
	/**
	 * The boolean type.
	 */
	record BooleanType() implements Type {
		@Override
		public String toString() {
			return "Boolean";
		}
	}

	/**
	 * A bounded integer type.
	 */
	record IntRangeType(long min, long max) implements Type {
		public IntRangeType {
			Preconditions.checkArgument(min <= max, "Empty range %s .. %s", min, max);
		}

		@Override
		public String toString() {
			return String.format("range %d .. %d", this.min, this.max);
		}
	}

	/**
	 * An enumeration type.
	 */
	record EnumType(ImmutableList<String> literals) implements Type {
		public EnumType {
			Preconditions.checkArgument(!literals.isEmpty(), "Enumeration without literals");
		}

		public static EnumType of(List<String> literals) {
			return new EnumType(ImmutableList.copyOf(literals));
		}

		public static EnumType of(String... literals) {
			return new EnumType(ImmutableList.copyOf(literals));
		}

		@Override
		public String toString() {
			return "(" + String.join(", ", this.literals) + ")";
		}
	}

	/**
	 * A pointer to values of another type.
	 */
	record PointerType(Type target) implements Type {
		public PointerType {
			Objects.requireNonNull(target);
		}

		@Override
		public String toString() {
			return "access " + this.target;
		}
	}
}
