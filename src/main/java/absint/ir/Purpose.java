package absint.ir;

import java.util.Objects;

/**
 * Why the frontend synthesized a node.  Checkers look for assume statements
 * carrying a given kind of purpose.
 */
public sealed interface Purpose permits Purpose.DerefCheck, Purpose.ExistCheck, Purpose.SyntheticVariable {
	/**
	 * The closed set of purpose kinds.
	 */
	enum Kind {
		DEREF_CHECK,
		EXIST_CHECK,
		SYNTHETIC_VARIABLE,
	}

	/**
	 * @return The kind of this purpose.
	 */
	Kind kind();

	/**
	 * @return Whether the node carries a purpose of the given kind.
	 */
	static boolean isPurposeOf(Kind kind, IrNode node) {
		return node.getData()
			.getPurpose()
			.filter(p -> p.kind() == kind)
			.isPresent();
	}

	/**
	 * Attached to an assume created to check that a dereference is safe.
	 *
	 * @param expr
	 *         The dereferenced expression.
	 */
	record DerefCheck(Expr expr) implements Purpose {
		public DerefCheck {
			Objects.requireNonNull(expr);
		}

		@Override
		public Kind kind() {
			return Kind.DEREF_CHECK;
		}
	}

	/**
	 * Attached to an assume created to check that a record field exists
	 * under the current value of its discriminant.
	 *
	 * @param accessedExpr
	 *         The record whose field is accessed.
	 * @param fieldName
	 *         The accessed field.
	 * @param discrName
	 *         The discriminant the field depends on.
	 */
	record ExistCheck(Expr accessedExpr, String fieldName, String discrName) implements Purpose {
		public ExistCheck {
			Objects.requireNonNull(accessedExpr);
			Objects.requireNonNull(fieldName);
			Objects.requireNonNull(discrName);
		}

		@Override
		public Kind kind() {
			return Kind.EXIST_CHECK;
		}
	}

	/**
	 * Attached to an identifier introduced to hold a temporary value.
	 */
	record SyntheticVariable() implements Purpose {
		@Override
		public Kind kind() {
			return Kind.SYNTHETIC_VARIABLE;
		}
	}
}
