package absint.ir;

import absint.ConfigurationException;

import java.util.List;

/**
 * IR pretty-printer.
 */
public final class PrettyPrinter {
	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();

	private PrettyPrinter() {
	}

	/**
	 * @return The textual form of a node.
	 */
	public static String print(IrNode node) {
		var printer = new PrettyPrinter();
		if (node instanceof Expr expr) {
			printer.expr(expr);
		} else if (node instanceof Stmt stmt) {
			printer.stmt(stmt, "");
			// Drop the trailing newline of single statements
			printer.out.setLength(printer.out.length() - 1);
		} else {
			throw new ConfigurationException("Cannot print %s", node.getClass().getSimpleName());
		}
		return printer.out.toString();
	}

	/**
	 * @return The textual form of a program.
	 */
	public static String print(Program program) {
		var printer = new PrettyPrinter();
		printer.out.append(program.getName()).append(":\n");
		printer.stmts(program.getStmts(), INDENT);
		return printer.out.toString();
	}

	private void expr(Expr expr) {
		if (expr instanceof Ident ident) {
			this.out.append(ident.getName());
		} else if (expr instanceof Lit lit) {
			this.out.append(lit.getValue());
		} else if (expr instanceof UnExpr un) {
			this.out.append(un.getOperator().getSymbol());
			operand(un.getOperand());
		} else if (expr instanceof BinExpr bin) {
			operand(bin.getLhs());
			this.out.append(' ').append(bin.getOperator().getSymbol()).append(' ');
			operand(bin.getRhs());
		} else {
			throw new ConfigurationException("Unknown expression %s", expr.getClass().getSimpleName());
		}
	}

	private void operand(Expr expr) {
		if (expr instanceof BinExpr) {
			this.out.append('(');
			expr(expr);
			this.out.append(')');
		} else {
			expr(expr);
		}
	}

	private void stmts(List<Stmt> stmts, String indent) {
		for (var stmt : stmts) {
			stmt(stmt, indent);
		}
	}

	private void stmt(Stmt stmt, String indent) {
		this.out.append(indent);

		if (stmt instanceof Assign assign) {
			expr(assign.getTarget());
			this.out.append(" = ");
			expr(assign.getExpr());
			this.out.append('\n');
		} else if (stmt instanceof Read read) {
			this.out.append("read(");
			expr(read.getTarget());
			this.out.append(")\n");
		} else if (stmt instanceof Use use) {
			this.out.append("use(");
			expr(use.getTarget());
			this.out.append(")\n");
		} else if (stmt instanceof Assume assume) {
			this.out.append("assume(");
			expr(assume.getExpr());
			this.out.append(")\n");
		} else if (stmt instanceof Split split) {
			this.out.append("split:\n");
			stmts(split.getFirst(), indent + INDENT);
			this.out.append(indent).append("|:\n");
			stmts(split.getSecond(), indent + INDENT);
		} else if (stmt instanceof Loop loop) {
			this.out.append("loop:\n");
			stmts(loop.getBody(), indent + INDENT);
		} else {
			throw new ConfigurationException("Unknown statement %s", stmt.getClass().getSimpleName());
		}
	}
}
