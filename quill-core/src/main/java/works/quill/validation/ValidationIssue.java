package works.quill.validation;

import static java.util.Objects.requireNonNull;

/**
 * Something a whole-document validation found. Issues never block editing.
 *
 * @param location a path to the offending element, like <code>/TEI/text/body/p[2]/said[1]</code>
 */
public record ValidationIssue(
	Severity severity,
	IssueCode code,
	String message,
	String location
) {
	public ValidationIssue {
		requireNonNull(severity);
		requireNonNull(code);
		requireNonNull(message);
		requireNonNull(location);
	}

	public boolean isCritical() {
		return severity == Severity.CRITICAL;
	}

	@Override
	public String toString() {
		return severity + " " + code + " at " + location + ": " + message;
	}
}
