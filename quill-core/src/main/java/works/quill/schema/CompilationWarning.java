package works.quill.schema;

/**
 * Something in a grammar the compiler could only approximate.
 *
 * @param context the element being compiled when the problem was found, or <code>grammar</code>
 */
public record CompilationWarning(Kind kind, String context, String message) {
	public enum Kind {
		/**
		 * An element with neither content nor attributes was assumed to hold text.
		 */
		DEFAULTED_TO_TEXT,

		/**
		 * A pattern the compiler doesn't understand was skipped.
		 */
		UNRECOGNIZED_PATTERN,

		/**
		 * A <code>ref</code> named a definition that doesn't exist.
		 */
		UNRESOLVED_REF,
	}

	@Override
	public String toString() {
		return kind + " in " + context + ": " + message;
	}
}
