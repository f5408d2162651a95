package works.quill.validation;

/**
 * What a {@link ValidationIssue} is about.
 */
public enum IssueCode {
	UNKNOWN_ELEMENT,
	MISSING_REQUIRED_ATTR,
	INVALID_ATTR_VALUE,
	UNRESOLVED_IDREF,
	CONTENT_MODEL_VIOLATION,
	UNDECLARED_ATTRIBUTE,
	UNEXPECTED_TEXT,
	ARCHIVED_REFERENCE,
}
