package absint.ir;

import java.util.List;
import java.util.Objects;

/**
 * A literal.  The value is kept in its concrete representation (numeral text,
 * enumerator name, boolean, "null") and converted by the model's builder.
 */
public final class Lit extends Expr {
	private final Object value;

	public Lit(Object value, NodeData data) {
		super(data);
		this.value = Objects.requireNonNull(value);
	}

	public Object getValue() {
		return this.value;
	}

	@Override
	public List<IrNode> children() {
		return List.of();
	}
}
