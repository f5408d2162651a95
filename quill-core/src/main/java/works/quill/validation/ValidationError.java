package works.quill.validation;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A reason to reject a mutation, with any mechanically derivable ways to fix it.
 */
public record ValidationError(
	ErrorCode code,
	String message,
	List<Fix> fixes
) {
	public ValidationError {
		requireNonNull(code);
		requireNonNull(message);
		fixes = List.copyOf(fixes);
	}

	public static ValidationError of(ErrorCode code, String message, Fix... fixes) {
		return new ValidationError(code, message, List.of(fixes));
	}

	@Override
	public String toString() {
		return code + ": " + message;
	}
}
