package works.quill.markup;

/**
 * Switch patterns are still a preview feature in Java 17,
 * so code that wants to deal with {@link Node} objects polymorphically
 * can use this instead.
 */
public interface NodeVisitor<R> {
	R visitElement(Element element);
	R visitText(Text text);

	default R visit(Node node) {
		if (node instanceof Element e) {
			return visitElement(e);
		} else if (node instanceof Text t) {
			return visitText(t);
		} else {
			throw new AssertionError("Unexpected node type: " + node.getClass().getSimpleName());
		}
	}
}
