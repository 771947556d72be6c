package absint.ir;

import java.util.List;
import java.util.Objects;

/**
 * {@code read target}: the variable receives an unknown value.
 */
public final class Read extends Stmt {
	private final Ident target;

	public Read(Ident target, NodeData data) {
		super(data);
		this.target = Objects.requireNonNull(target);
	}

	public Ident getTarget() {
		return this.target;
	}

	@Override
	public List<Ident> children() {
		return List.of(this.target);
	}
}
