package works.quill.exceptions;

import java.util.List;

/**
 * Thrown when none of the candidate schemas could even be loaded,
 * which is a configuration problem rather than a property of the document.
 */
public class SchemaConfigurationException extends IllegalStateException {
	private final List<SchemaLoadException> failures;

	public SchemaConfigurationException(String message, List<SchemaLoadException> failures) {
		super(message, failures.isEmpty() ? null : failures.get(0));
		this.failures = List.copyOf(failures);
		failures.stream().skip(1).forEach(this::addSuppressed);
	}

	public List<SchemaLoadException> failures() {
		return failures;
	}
}
