package works.quill.exceptions;

/**
 * A delta log could not be replayed, meaning some delta in it was never
 * valid against the state preceding it.
 */
public class CorruptDeltaLogException extends IllegalStateException {
	public CorruptDeltaLogException(String message, Throwable cause) { super(message, cause); }
}
