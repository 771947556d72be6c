package absint.ir;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Repeats its body any number of times (including zero).
 */
public final class Loop extends Stmt {
	private final ImmutableList<Stmt> body;

	public Loop(List<Stmt> body, NodeData data) {
		super(data);
		this.body = ImmutableList.copyOf(body);
	}

	public ImmutableList<Stmt> getBody() {
		return this.body;
	}

	@Override
	public List<Stmt> children() {
		return this.body;
	}
}
