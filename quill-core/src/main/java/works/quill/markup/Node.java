package works.quill.markup;

/**
 * A node of a parsed markup tree: either an {@link Element} or a run of {@link Text}.
 * <p>
 * Trees are immutable values; "modifying" one means building a new tree
 * that shares the unchanged subtrees.
 */
public sealed interface Node permits Element, Text {
	/**
	 * The concatenation of all text beneath this node, in document order.
	 */
	String textContent();

	default <R> R accept(NodeVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
