package works.quill.exceptions;

public class SchemaParseException extends SchemaLoadException {
	public SchemaParseException(String schemaId, String message) { super(schemaId, message); }
	public SchemaParseException(String schemaId, String message, Throwable cause) { super(schemaId, message, cause); }
}
