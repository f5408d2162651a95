package works.quill.document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import works.quill.Identified;
import works.quill.Identifier;

import static java.util.Objects.requireNonNull;

/**
 * One block of text (a paragraph, verse line, heading...) and the tags laid over it.
 * <p>
 * Tags are always held in canonical order: by start ascending, then end descending,
 * then outer before inner for tags with identical ranges. That is exactly the
 * order in which their elements open in the markup.
 */
public record Passage(
	Identifier id,
	int index,
	String element,
	String content,
	List<Tag> tags
) implements Identified {
	public Passage {
		requireNonNull(id);
		requireNonNull(element);
		requireNonNull(content);
		tags = List.copyOf(tags);
	}

	/**
	 * @param element the name of the block element the passage came from
	 * @param tags in nesting order (outer before inner) where ranges are identical;
	 *             their ids are ignored and reassigned.
	 */
	public static Passage create(int index, String element, String content, List<Tag> tags) {
		Identifier id = Identifier.prefixed("passage", Fingerprints.shortHash(content, index));
		return new Passage(id, index, element, content, List.of()).withTags(tags);
	}

	/**
	 * @return a passage with the given tags, put into canonical order and given their canonical ids.
	 * Where ranges are identical, the relative order of <code>newTags</code> determines nesting.
	 */
	public Passage withTags(List<Tag> newTags) {
		List<Tag> sorted = new ArrayList<>(newTags);
		sorted.sort(CANONICAL_ORDER); // List.sort is stable
		Map<String, Integer> occurrences = new HashMap<>();
		List<Tag> identified = new ArrayList<>(sorted.size());
		for (Tag tag: sorted) {
			String key = tag.type() + "@" + tag.range().start() + ":" + tag.range().end();
			int k = occurrences.merge(key, 1, Integer::sum) - 1;
			identified.add(tag.withId(Identifier.prefixed("tag", Fingerprints.shortHash(id, tag.type(), tag.range().start(), tag.range().end(), k))));
		}
		return new Passage(id, index, element, content, identified);
	}

	public Optional<Tag> tag(Identifier tagId) {
		return tags.stream().filter(t -> t.id().equals(tagId)).findFirst();
	}

	public String textOf(TextRange range) {
		return range.of(content);
	}

	public static final Comparator<Tag> CANONICAL_ORDER = Comparator
		.comparingInt((Tag t) -> t.range().start())
		.thenComparing(t -> t.range().end(), Comparator.reverseOrder());
}
