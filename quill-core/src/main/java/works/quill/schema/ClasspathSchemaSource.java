package works.quill.schema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import works.quill.exceptions.SchemaLoadException;

/**
 * Reads grammars bundled as resources, using {@link SchemaInfo#resourcePath} as the resource name.
 */
public final class ClasspathSchemaSource implements SchemaSource {
	@Override
	public String fetch(SchemaInfo schema) throws SchemaLoadException {
		try (InputStream in = ClasspathSchemaSource.class.getResourceAsStream(schema.resourcePath())) {
			if (in == null) {
				throw new SchemaLoadException(schema.id(), "No resource " + schema.resourcePath() + " for schema \"" + schema.id() + "\"");
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new SchemaLoadException(schema.id(), "Unable to read " + schema.resourcePath(), e);
		}
	}
}
