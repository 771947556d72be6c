package absint.ir;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * An IR program: the body of one subprogram.
 */
public final class Program {
	private final String name;
	private final ImmutableList<Stmt> stmts;

	public Program(String name, List<Stmt> stmts) {
		this.name = Objects.requireNonNull(name);
		this.stmts = ImmutableList.copyOf(stmts);
	}

	public String getName() {
		return this.name;
	}

	public ImmutableList<Stmt> getStmts() {
		return this.stmts;
	}

	/**
	 * @return Every node of this program, in pre-order.
	 */
	public Stream<IrNode> nodes() {
		return this.stmts.stream().flatMap(IrNode::descendants);
	}

	/**
	 * @return The distinct variables of this program, in order of first occurrence.
	 */
	public ImmutableList<Ident> variables() {
		return nodes()
			.filter(n -> n instanceof Ident)
			.map(n -> (Ident) n)
			.distinct()
			.collect(ImmutableList.toImmutableList());
	}

	@Override
	public String toString() {
		return PrettyPrinter.print(this);
	}
}
