package works.quill.schema;

import works.quill.exceptions.SchemaLoadException;

/**
 * Fetches the text of a schema's grammar.
 */
public interface SchemaSource {
	String fetch(SchemaInfo schema) throws SchemaLoadException;
}
