package works.quill.exceptions;

/**
 * Indicates that markup text could not be turned into a document or tree.
 * No partial result is ever produced alongside this exception.
 */
public class ParseException extends Exception {
	public ParseException(String message) { super(message); }
	public ParseException(String message, Throwable cause) { super(message, cause); }
}
