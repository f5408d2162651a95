package works.quill.logging;

/**
 * Keys to use for SLF4J's Mapped Diagnostic Context.
 */
public final class MdcKeys {
	/**
	 * The name of the {@link works.quill.EditSession} (or other caller-chosen document name)
	 * on whose behalf the engine is working.
	 */
	public static final String DOCUMENT = "quill.document";

	/**
	 * The revision of the document being mutated or validated.
	 */
	public static final String REVISION = "quill.revision";

	/**
	 * The id of the schema being compiled or validated against.
	 */
	public static final String SCHEMA = "quill.schema";
}
