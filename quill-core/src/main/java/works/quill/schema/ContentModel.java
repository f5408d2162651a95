package works.quill.schema;

import java.util.Set;

/**
 * What may appear inside an element.
 * <p>
 * If {@link #textOnly}, only text. If {@link #mixedContent}, text interleaved with
 * any of the {@link #allowedChildren}. Otherwise only the allowed children,
 * with whitespace between them; an element-only model with no allowed children is empty.
 */
public record ContentModel(
	boolean textOnly,
	boolean mixedContent,
	Set<String> allowedChildren
) {
	public ContentModel {
		allowedChildren = Set.copyOf(allowedChildren);
	}

	public static ContentModel text() {
		return new ContentModel(true, false, Set.of());
	}

	public static ContentModel mixed(Set<String> children) {
		return new ContentModel(false, true, children);
	}

	public static ContentModel elements(Set<String> children) {
		return new ContentModel(false, false, children);
	}

	public static ContentModel empty() {
		return new ContentModel(false, false, Set.of());
	}

	public boolean allowsText() {
		return textOnly || mixedContent;
	}

	public boolean allowsChild(String elementName) {
		return !textOnly && allowedChildren.contains(elementName);
	}
}
