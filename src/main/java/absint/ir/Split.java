package absint.ir;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Non-deterministic choice between two statement sequences.
 *
 * Conditionals are lowered by the frontend into a split whose branches start
 * with {@code assume cond} and {@code assume !cond} respectively.
 */
public final class Split extends Stmt {
	private final ImmutableList<Stmt> first;
	private final ImmutableList<Stmt> second;

	public Split(List<Stmt> first, List<Stmt> second, NodeData data) {
		super(data);
		this.first = ImmutableList.copyOf(first);
		this.second = ImmutableList.copyOf(second);
	}

	public ImmutableList<Stmt> getFirst() {
		return this.first;
	}

	public ImmutableList<Stmt> getSecond() {
		return this.second;
	}

	@Override
	public List<Stmt> children() {
		return ImmutableList.<Stmt>builder()
			.addAll(this.first)
			.addAll(this.second)
			.build();
	}
}
