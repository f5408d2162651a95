package works.quill.document;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import works.quill.Catalog;
import works.quill.Identifier;
import works.quill.entities.Character;
import works.quill.entities.EntityCollection;
import works.quill.entities.Organization;
import works.quill.entities.Place;
import works.quill.entities.Relationship;
import works.quill.markup.Element;

import static java.util.Objects.requireNonNull;

/**
 * One immutable revision of an annotated text.
 * <p>
 * The {@link #tree} and {@link #rawText} are always a rendering of the same state
 * as the derived indices ({@link #passages}, {@link #dialogue}, {@link #entities}).
 * Every accepted mutation produces a new document whose revision is one higher.
 */
public record Document(
	String rawText,
	Element tree,
	long revision,
	DocumentMetadata metadata,
	List<Passage> passages,
	List<DialogueSpan> dialogue,
	EntityCollection entities
) {
	public Document {
		requireNonNull(rawText);
		requireNonNull(tree);
		requireNonNull(metadata);
		requireNonNull(entities);
		if (revision < 0) {
			throw new IllegalArgumentException("Revision can't be negative: " + revision);
		}
		passages = List.copyOf(passages);
		dialogue = List.copyOf(dialogue);
	}

	public Catalog<Character> characters() {
		return entities.characters();
	}

	public Catalog<Place> places() {
		return entities.places();
	}

	public Catalog<Organization> organizations() {
		return entities.organizations();
	}

	public Catalog<Relationship> relationships() {
		return entities.relationships();
	}

	public Optional<Passage> passage(Identifier passageId) {
		return passages.stream().filter(p -> p.id().equals(passageId)).findFirst();
	}

	/**
	 * Everything an IDREF token may name once its leading <code>#</code> is stripped:
	 * each entity's xmlId and id, and every <code>xml:id</code> declared in the markup.
	 */
	public Set<String> referenceTargets() {
		Set<String> result = new HashSet<>();
		collectXmlIds(tree, result);
		entities.entities().forEach(e -> {
			result.add(e.xmlId());
			result.add(e.id().toString());
		});
		return result;
	}

	private static void collectXmlIds(Element element, Set<String> result) {
		element.attribute("xml:id").ifPresent(result::add);
		element.childElements().forEach(child -> collectXmlIds(child, result));
	}

	/**
	 * The SHA-256 of {@link #rawText}, distinguishing documents that share a revision number.
	 */
	public String fingerprint() {
		return Fingerprints.sha256(rawText);
	}
}
