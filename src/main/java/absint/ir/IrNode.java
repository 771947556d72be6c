package absint.ir;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Base class of every IR node.
 *
 * Nodes use identity equality: the model and the environments are keyed by
 * node instances, so a frontend must share one {@link Ident} per variable.
 */
public abstract class IrNode {
	private final NodeData data;

	IrNode(NodeData data) {
		this.data = Objects.requireNonNull(data);
	}

	/**
	 * @return The metadata attached to this node.
	 */
	public NodeData getData() {
		return this.data;
	}

	/**
	 * @return The direct sub-nodes of this node, in evaluation order.
	 */
	public abstract List<? extends IrNode> children();

	/**
	 * @return This node and all of its descendants, in pre-order.
	 */
	public Stream<IrNode> descendants() {
		return Stream.concat(
			Stream.of(this),
			children().stream().flatMap(IrNode::descendants));
	}

	@Override
	public String toString() {
		return PrettyPrinter.print(this);
	}
}
