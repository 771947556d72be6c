package absint.ir;

/**
 * IR operators.
 */
public enum Operator {
	LT("<", 2),
	LE("<=", 2),
	EQ("==", 2),
	NEQ("!=", 2),
	GE(">=", 2),
	GT(">", 2),
	PLUS("+", 2),
	MINUS("-", 2),
	AND("&&", 2),
	OR("||", 2),

	NOT("!", 1),
	NEG("-", 1),
	DEREF("*", 1),
	ADDRESS("&", 1);

	private final String symbol;
	private final int arity;

	Operator(String symbol, int arity) {
		this.symbol = symbol;
		this.arity = arity;
	}

	/**
	 * @return The textual symbol of this operator.
	 */
	public String getSymbol() {
		return this.symbol;
	}

	/**
	 * @return The number of operands.
	 */
	public int getArity() {
		return this.arity;
	}

	/**
	 * @return Whether the operator yields a boolean.
	 */
	public boolean isComparison() {
		switch (this) {
		case LT:
		case LE:
		case EQ:
		case NEQ:
		case GE:
		case GT:
			return true;
		default:
			return false;
		}
	}
}
