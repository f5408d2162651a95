package works.quill.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import works.quill.Identified;
import works.quill.Identifier;

import static java.util.Objects.requireNonNull;

/**
 * An element wrapped around a range of a passage's text.
 * <p>
 * The id is assigned by the owning {@link Passage}, and depends only on
 * the passage, the tag's type and range, and how many identical tags precede it,
 * so parsing the same markup always reproduces the same ids.
 */
public record Tag(
	Identifier id,
	String type,
	Map<String, String> attributes,
	TextRange range
) implements Identified {
	public Tag {
		requireNonNull(id);
		requireNonNull(type);
		requireNonNull(range);
		attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}

	/**
	 * A tag that has not yet been placed in a passage.
	 * Its id is replaced by {@link Passage#withTags}.
	 */
	public static Tag unplaced(String type, Map<String, String> attributes, TextRange range) {
		return new Tag(UNPLACED, type, attributes, range);
	}

	public Optional<String> attribute(String name) {
		return Optional.ofNullable(attributes.get(name));
	}

	public Tag withId(Identifier newId) {
		return new Tag(newId, type, attributes, range);
	}

	public Tag withAttributes(Map<String, String> newAttributes) {
		return new Tag(id, type, newAttributes, range);
	}

	/**
	 * Same type, range and attributes; ids are ignored.
	 */
	public boolean isIdenticalTo(Tag other) {
		return type.equals(other.type)
			&& range.equals(other.range)
			&& attributes.equals(other.attributes);
	}

	private static final Identifier UNPLACED = Identifier.from("tag-unplaced");
}
