package absint.ir;

import java.util.List;
import java.util.Objects;

/**
 * {@code use target}: marks a read of the variable, without effect on its value.
 */
public final class Use extends Stmt {
	private final Ident target;

	public Use(Ident target, NodeData data) {
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
