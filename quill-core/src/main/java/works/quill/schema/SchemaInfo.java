package works.quill.schema;

import java.util.List;

/**
 * Describes one schema the engine can validate against.
 *
 * @param resourcePath where a {@link SchemaSource} should look for the grammar
 * @param tags free-form labels such as <code>strict</code> or <code>permissive</code>
 */
public record SchemaInfo(
	String id,
	String name,
	String description,
	String resourcePath,
	List<String> tags
) {
	public SchemaInfo {
		tags = List.copyOf(tags);
	}
}
