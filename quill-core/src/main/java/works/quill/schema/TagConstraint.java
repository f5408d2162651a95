package works.quill.schema;

import java.util.List;

/**
 * Which attributes an element must have and which it may have.
 * Attribute names are in the order the grammar first mentions them.
 */
public record TagConstraint(
	String tagName,
	List<String> requiredAttributes,
	List<String> optionalAttributes
) {
	public TagConstraint {
		requiredAttributes = List.copyOf(requiredAttributes);
		optionalAttributes = List.copyOf(optionalAttributes);
	}

	public boolean declares(String attributeName) {
		return requiredAttributes.contains(attributeName) || optionalAttributes.contains(attributeName);
	}
}
