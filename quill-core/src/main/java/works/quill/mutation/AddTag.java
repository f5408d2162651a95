package works.quill.mutation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import works.quill.Identifier;
import works.quill.document.TextRange;

import static java.util.Objects.requireNonNull;

/**
 * Wrap <code>range</code> of a passage's text in a new element of the given type.
 */
public record AddTag(
	Identifier passageId,
	TextRange range,
	String type,
	Map<String, String> attributes
) implements Mutation {
	public AddTag {
		requireNonNull(passageId);
		requireNonNull(range);
		requireNonNull(type);
		attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}
}
