package works.quill.exceptions;

import works.quill.validation.ValidationError;

/**
 * A mutation was rejected. Nothing was changed.
 */
public class ValidationException extends Exception {
	private final ValidationError error;

	public ValidationException(ValidationError error) {
		super(error.toString());
		this.error = error;
	}

	public ValidationError error() {
		return error;
	}
}
