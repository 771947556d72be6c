package absint.ir;

/**
 * Thrown when an expression cannot be evaluated statically.
 */
public class NotConstExprException extends Exception {
	private static final long serialVersionUID = 1L;

	private final transient Expr expr;

	public NotConstExprException(Expr expr) {
		super("Not a constant expression: " + expr);
		this.expr = expr;
	}

	/**
	 * @return The offending sub-expression.
	 */
	public Expr getExpr() {
		return this.expr;
	}
}
