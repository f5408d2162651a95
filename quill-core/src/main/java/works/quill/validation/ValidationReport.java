package works.quill.validation;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of validating a document against a sequence of schemas.
 *
 * @param passedSchemaId the first schema, in the order tried, that the document conforms to
 * @param errors if some schema passed, empty; otherwise the critical issues from the strictest schema that could be loaded
 * @param warnings non-critical issues from the same schema as {@link #errors}, or from the passing schema
 * @param skippedSchemaIds schemas that could not be loaded or compiled, and so were not tried
 */
public record ValidationReport(
	Optional<String> passedSchemaId,
	List<ValidationIssue> errors,
	List<ValidationIssue> warnings,
	List<String> skippedSchemaIds
) {
	public ValidationReport {
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
		skippedSchemaIds = List.copyOf(skippedSchemaIds);
	}

	public boolean passed() {
		return passedSchemaId.isPresent();
	}
}
