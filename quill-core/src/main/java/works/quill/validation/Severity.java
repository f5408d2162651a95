package works.quill.validation;

public enum Severity {
	/**
	 * The document does not conform to the schema.
	 */
	CRITICAL,
	WARNING,
	INFO,
}
