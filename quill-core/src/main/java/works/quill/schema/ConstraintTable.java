package works.quill.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

/**
 * Constant-time lookups of the constraints a grammar places on each element.
 * Immutable, and therefore safe to share between sessions and threads.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConstraintTable {
	private final Map<String, TagConstraint> tags;
	private final Map<String, Map<String, AttributeConstraint>> attributes;
	private final Map<String, ContentModel> contentModels;
	private final List<CompilationWarning> warnings;

	public static ConstraintTable of(
		Map<String, TagConstraint> tags,
		Map<String, Map<String, AttributeConstraint>> attributes,
		Map<String, ContentModel> contentModels,
		List<CompilationWarning> warnings
	) {
		Map<String, Map<String, AttributeConstraint>> attributeCopy = new LinkedHashMap<>();
		attributes.forEach((tag, byName) -> attributeCopy.put(tag, Collections.unmodifiableMap(new LinkedHashMap<>(byName))));
		return new ConstraintTable(
			Collections.unmodifiableMap(new LinkedHashMap<>(tags)),
			Collections.unmodifiableMap(attributeCopy),
			Collections.unmodifiableMap(new LinkedHashMap<>(contentModels)),
			List.copyOf(warnings));
	}

	public Optional<TagConstraint> tag(String tagName) {
		return Optional.ofNullable(tags.get(tagName));
	}

	public boolean declares(String tagName) {
		return tags.containsKey(tagName);
	}

	public Optional<AttributeConstraint> attribute(String tagName, String attributeName) {
		return Optional.ofNullable(attributes.getOrDefault(tagName, Map.of()).get(attributeName));
	}

	public Map<String, AttributeConstraint> attributes(String tagName) {
		return attributes.getOrDefault(tagName, Map.of());
	}

	public Optional<ContentModel> contentModel(String tagName) {
		return Optional.ofNullable(contentModels.get(tagName));
	}

	public Set<String> tagNames() {
		return tags.keySet();
	}

	public List<CompilationWarning> warnings() {
		return warnings;
	}

	@Override
	public String toString() {
		return "ConstraintTable{" + tags.size() + " elements, " + warnings.size() + " warnings}";
	}
}
