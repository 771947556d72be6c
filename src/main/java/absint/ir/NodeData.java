package absint.ir;

import java.util.Objects;
import java.util.Optional;

/**
 * Metadata attached to an IR node by the frontend.
 */
public final class NodeData {
	private static final NodeData EMPTY = new NodeData(null, null, null);

	private final Object typeHint;
	private final Purpose purpose;
	private final Object origin;

	private NodeData(Object typeHint, Purpose purpose, Object origin) {
		this.typeHint = typeHint;
		this.purpose = purpose;
		this.origin = origin;
	}

	/**
	 * @return Metadata with nothing attached.
	 */
	public static NodeData empty() {
		return EMPTY;
	}

	/**
	 * @return Metadata carrying only a type hint.
	 */
	public static NodeData typed(Object typeHint) {
		return new NodeData(Objects.requireNonNull(typeHint), null, null);
	}

	/**
	 * @return A copy of this metadata with the given type hint.
	 */
	public NodeData withTypeHint(Object typeHint) {
		return new NodeData(typeHint, this.purpose, this.origin);
	}

	/**
	 * @return A copy of this metadata with the given purpose.
	 */
	public NodeData withPurpose(Purpose purpose) {
		return new NodeData(this.typeHint, purpose, this.origin);
	}

	/**
	 * @return A copy of this metadata with the given source origin.
	 */
	public NodeData withOrigin(Object origin) {
		return new NodeData(this.typeHint, this.purpose, origin);
	}

	/**
	 * @return The frontend's type hint, if the node is typed.
	 */
	public Optional<Object> getTypeHint() {
		return Optional.ofNullable(this.typeHint);
	}

	/**
	 * @return Why the frontend synthesized this node, if it did.
	 */
	public Optional<Purpose> getPurpose() {
		return Optional.ofNullable(this.purpose);
	}

	/**
	 * @return The source-language node this IR node was lowered from, if any.
	 */
	public Optional<Object> getOrigin() {
		return Optional.ofNullable(this.origin);
	}

	@Override
	public String toString() {
		return String.format("{hint: %s, purpose: %s, origin: %s}", this.typeHint, this.purpose, this.origin);
	}
}
