package absint.cfg;

import absint.ir.Stmt;

import java.util.Objects;
import java.util.Optional;

/**
 * A program point of a control flow graph.
 *
 * Nodes use identity equality; names are unique within one graph.
 */
public final class CfgNode {
	private final String name;
	private final Stmt stmt;
	private final boolean wideningPoint;

	CfgNode(String name, Stmt stmt, boolean wideningPoint) {
		this.name = Objects.requireNonNull(name);
		this.stmt = stmt;
		this.wideningPoint = wideningPoint;
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The statement this node was lowered from, if any.
	 */
	public Optional<Stmt> getStmt() {
		return Optional.ofNullable(this.stmt);
	}

	/**
	 * @return Whether values are widened rather than joined at this node.
	 */
	public boolean isWideningPoint() {
		return this.wideningPoint;
	}

	@Override
	public String toString() {
		return this.name;
	}
}
