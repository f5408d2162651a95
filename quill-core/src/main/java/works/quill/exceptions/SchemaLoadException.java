package works.quill.exceptions;

/**
 * A schema could not be obtained, either because its grammar could not be
 * fetched or (see {@link SchemaParseException}) because it could not be compiled.
 * Fatal only for the schema in question.
 */
public class SchemaLoadException extends Exception {
	private final String schemaId;

	public SchemaLoadException(String schemaId, String message) {
		super(message);
		this.schemaId = schemaId;
	}

	public SchemaLoadException(String schemaId, String message, Throwable cause) {
		super(message, cause);
		this.schemaId = schemaId;
	}

	public String schemaId() {
		return schemaId;
	}
}
