package works.quill.schema;

import java.util.List;

/**
 * @param allowedValues for {@link AttributeType#ENUMERATED} attributes, the permitted values in grammar order;
 *                      otherwise empty.
 */
public record AttributeConstraint(
	String name,
	AttributeType type,
	boolean required,
	List<String> allowedValues
) {
	public AttributeConstraint {
		allowedValues = List.copyOf(allowedValues);
	}

	public boolean allows(String value) {
		return type != AttributeType.ENUMERATED || allowedValues.contains(value);
	}

	/**
	 * The value to suggest when the attribute is missing.
	 */
	public String defaultValue() {
		return allowedValues.isEmpty() ? "" : allowedValues.get(0);
	}
}
