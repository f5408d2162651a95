package works.quill.mutation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import works.quill.Identifier;

/**
 * Replace all of a tag's attributes with <code>attributes</code>.
 */
public record ChangeTagAttributes(
	Identifier passageId,
	Identifier tagId,
	Map<String, String> attributes
) implements Mutation {
	public ChangeTagAttributes {
		attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}
}
