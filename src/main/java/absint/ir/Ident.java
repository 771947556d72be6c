package absint.ir;

import java.util.List;
import java.util.Objects;

/**
 * A variable reference.
 */
public final class Ident extends Expr {
	private final String name;

	public Ident(String name, NodeData data) {
		super(data);
		this.name = Objects.requireNonNull(name);
	}

	public String getName() {
		return this.name;
	}

	@Override
	public List<IrNode> children() {
		return List.of();
	}
}
