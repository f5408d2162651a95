package works.quill.document;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.Catalog;
import works.quill.Identifier;
import works.quill.entities.Character;
import works.quill.entities.Entity;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityType;
import works.quill.entities.Organization;
import works.quill.entities.Place;
import works.quill.entities.Relationship;
import works.quill.entities.Slugs;
import works.quill.exceptions.ParseException;
import works.quill.markup.Element;
import works.quill.markup.MarkupReader;
import works.quill.markup.Node;
import works.quill.markup.Text;

/**
 * Builds a revision-0 {@link Document} from markup text, deriving all of its indices.
 * Parsing is deterministic: the same text always yields equal documents,
 * identifiers included.
 */
@RequiredArgsConstructor
public final class DocumentParser {
	@Getter private final ParserConfiguration configuration;

	public Document parse(String text) throws ParseException {
		Element root = MarkupReader.read(text);
		DocumentMetadata metadata = readMetadata(root);
		List<Passage> passages = readPassages(root);
		EntityCollection entities = readEntities(root);
		List<DialogueSpan> dialogue = deriveDialogue(passages);
		LOGGER.debug("Parsed \"{}\": {} passages, {} dialogue spans, {} entities, {} relationships",
			metadata.title(), passages.size(), dialogue.size(), entities.entities().count(), entities.relationships().size());
		return new Document(text, root, 0, metadata, passages, dialogue, entities);
	}

	/**
	 * Speech spans are a pure function of the passages' tags, so they're rebuilt
	 * from scratch whenever tags change rather than edited directly.
	 */
	public List<DialogueSpan> deriveDialogue(List<Passage> passages) {
		List<DialogueSpan> result = new ArrayList<>();
		for (Passage passage: passages) {
			for (Tag tag: passage.tags()) {
				if (configuration.speechElements().contains(tag.type())) {
					result.add(new DialogueSpan(
						tag.id(),
						passage.id(),
						tag.attribute(configuration.speakerAttribute()).flatMap(DocumentParser::stripReferences),
						tag.attribute(configuration.addresseeAttribute()).flatMap(DocumentParser::stripReferences),
						passage.textOf(tag.range()),
						tag.range()));
				}
			}
		}
		return result;
	}

	/**
	 * <code>"#alice #bob"</code> becomes <code>"alice bob"</code>.
	 */
	static Optional<String> stripReferences(String attributeValue) {
		String result = Arrays.stream(attributeValue.trim().split("\\s+"))
			.map(token -> token.startsWith("#") ? token.substring(1) : token)
			.filter(token -> !token.isEmpty())
			.collect(Collectors.joining(" "));
		return result.isEmpty() ? Optional.empty() : Optional.of(result);
	}

	private static DocumentMetadata readMetadata(Element root) {
		Optional<Element> titleStmt = root.firstChild("teiHeader")
			.flatMap(h -> h.firstChild("fileDesc"))
			.flatMap(f -> f.firstChild("titleStmt"));
		return new DocumentMetadata(
			titleStmt.flatMap(t -> t.childText("title")).orElse(DocumentMetadata.DEFAULT_TITLE),
			titleStmt.flatMap(t -> t.childText("author")).orElse(DocumentMetadata.DEFAULT_AUTHOR));
	}

	private List<Passage> readPassages(Element root) {
		List<Element> blocks = new ArrayList<>();
		if (configuration.blockElements().contains(root.name())) {
			blocks.add(root);
		} else {
			collectBlocks(root, blocks);
		}
		List<Passage> result = new ArrayList<>(blocks.size());
		for (Element block: blocks) {
			TagCollector collector = new TagCollector();
			collector.collect(block);
			result.add(Passage.create(result.size(), block.name(), block.textContent(), collector.tags));
		}
		return result;
	}

	/**
	 * Document order. Blocks nested in other blocks are tags of the outer block, not passages.
	 */
	private void collectBlocks(Element element, List<Element> blocks) {
		for (Node child: element.children()) {
			if (child instanceof Element e && !configuration.skippedSections().contains(e.name())) {
				if (configuration.blockElements().contains(e.name())) {
					blocks.add(e);
				} else {
					collectBlocks(e, blocks);
				}
			}
		}
	}

	/**
	 * Records every descendant element in preorder, with its plain-text offsets.
	 */
	private static final class TagCollector {
		final List<Tag> tags = new ArrayList<>();
		int offset = 0;

		void collect(Element parent) {
			for (Node child: parent.children()) {
				if (child instanceof Text t) {
					offset += t.value().length();
				} else if (child instanceof Element e) {
					int start = offset;
					int position = tags.size();
					tags.add(null); // Reserve the preorder position
					collect(e);
					tags.set(position, Tag.unplaced(e.name(), e.attributes(), TextRange.of(start, offset)));
				}
			}
		}
	}

	private static EntityCollection readEntities(Element root) throws ParseException {
		List<Element> standOffs = root.childElements("standOff").collect(Collectors.toList());
		List<Character> characters = new ArrayList<>();
		List<Place> places = new ArrayList<>();
		List<Organization> organizations = new ArrayList<>();
		try {
			for (Element standOff: standOffs) {
				for (Element person: descendants(standOff, EntityType.CHARACTER.elementName())) {
					characters.add(readCharacter(person));
				}
				for (Element place: descendants(standOff, EntityType.PLACE.elementName())) {
					places.add(readPlace(place));
				}
				for (Element org: descendants(standOff, EntityType.ORGANIZATION.elementName())) {
					organizations.add(readOrganization(org));
				}
			}
			List<Entity> all = new ArrayList<>(characters);
			all.addAll(places);
			all.addAll(organizations);
			Set<String> xmlIds = new HashSet<>();
			for (Entity entity: all) {
				if (!xmlIds.add(entity.xmlId())) {
					throw new ParseException("Duplicate entity xml:id \"" + entity.xmlId() + "\"");
				}
			}
			EntityCollection entities = new EntityCollection(
				Catalog.of(characters), Catalog.of(places), Catalog.of(organizations), Catalog.empty());
			List<Relationship> relationships = new ArrayList<>();
			for (Element standOff: standOffs) {
				for (Element relation: descendants(standOff, EntityType.RELATIONSHIP.elementName())) {
					relationships.addAll(readRelationships(relation, entities));
				}
			}
			return new EntityCollection(
				entities.characters(), entities.places(), entities.organizations(), Catalog.of(relationships));
		} catch (IllegalArgumentException e) {
			throw new ParseException("Invalid entity list: " + e.getMessage(), e);
		}
	}

	private static List<Element> descendants(Element element, String name) {
		List<Element> result = new ArrayList<>();
		element.childElements().forEach(child -> {
			if (child.name().equals(name)) {
				result.add(child);
			} else {
				result.addAll(descendants(child, name));
			}
		});
		return result;
	}

	private static String xmlIdOf(Element element, Optional<String> name) throws ParseException {
		Optional<String> xmlId = element.attribute("xml:id").map(String::trim).filter(s -> !s.isEmpty());
		if (xmlId.isPresent()) {
			return xmlId.get();
		} else if (name.isPresent()) {
			return Slugs.slug(name.get());
		} else {
			throw new ParseException("<" + element.name() + "> has neither an xml:id nor a name");
		}
	}

	private static boolean isArchived(Element element) {
		return element.attribute(ARCHIVED_ATTRIBUTE).map(ARCHIVED_VALUE::equals).orElse(false);
	}

	/**
	 * The <code>value</code> attribute if present, else the element's text.
	 */
	private static Optional<String> valueOf(Element parent, String childName) {
		Optional<String> attribute = parent.firstChild(childName)
			.flatMap(e -> e.attribute("value"))
			.map(String::trim)
			.filter(s -> !s.isEmpty());
		return attribute.isPresent() ? attribute : parent.childText(childName);
	}

	private static Character readCharacter(Element person) throws ParseException {
		Optional<String> name = person.childText("persName");
		String xmlId = xmlIdOf(person, name);
		Optional<Integer> age = valueOf(person, "age").flatMap(s -> {
			try {
				return Optional.of(Integer.valueOf(s));
			} catch (NumberFormatException e) {
				LOGGER.debug("Ignoring non-numeric age \"{}\" of {}", s, xmlId);
				return Optional.empty();
			}
		});
		List<String> traits = person.childElements("trait")
			.map(t -> t.childText("desc").orElse(t.textContent().trim()))
			.filter(s -> !s.isEmpty())
			.collect(Collectors.toList());
		Optional<String> maritalStatus = person.childElements("state")
			.filter(s -> s.attribute("type").map("marital"::equals).orElse(false))
			.findFirst()
			.flatMap(s -> s.childText("desc").or(() -> Optional.of(s.textContent().trim()).filter(t -> !t.isEmpty())));
		return new Character(
			Slugs.entityId(EntityType.CHARACTER, xmlId),
			xmlId,
			name.orElse(xmlId),
			valueOf(person, "sex"),
			age,
			person.childText("occupation"),
			traits,
			person.childText("socecStatus"),
			maritalStatus,
			isArchived(person));
	}

	private static Place readPlace(Element place) throws ParseException {
		Optional<String> name = place.childText("placeName");
		String xmlId = xmlIdOf(place, name);
		return new Place(
			Slugs.entityId(EntityType.PLACE, xmlId),
			xmlId,
			name.orElse(xmlId),
			place.childText("country"),
			place.firstChild("location").flatMap(l -> l.childText("geo")),
			isArchived(place));
	}

	private static Organization readOrganization(Element org) throws ParseException {
		Optional<String> name = org.childText("orgName");
		String xmlId = xmlIdOf(org, name);
		return new Organization(
			Slugs.entityId(EntityType.ORGANIZATION, xmlId),
			xmlId,
			name.orElse(xmlId),
			org.attribute("type"),
			isArchived(org));
	}

	/**
	 * A <code>mutual</code> relation yields the pair of records; <code>active</code>/<code>passive</code> yields one.
	 * Relations whose endpoints aren't known entities are dropped with a warning.
	 */
	private static List<Relationship> readRelationships(Element relation, EntityCollection entities) {
		String type = relation.attribute("name").or(() -> relation.attribute("type")).orElse(DEFAULT_RELATION_TYPE);
		Optional<String> subtype = relation.attribute("subtype");
		List<String> endpoints;
		boolean mutual;
		if (relation.attribute("mutual").isPresent()) {
			endpoints = references(relation.attribute("mutual").get());
			mutual = true;
		} else {
			endpoints = Stream.of("active", "passive")
				.map(relation::attribute)
				.flatMap(Optional::stream)
				.flatMap(v -> references(v).stream())
				.collect(Collectors.toList());
			mutual = false;
		}
		if (endpoints.size() < 2) {
			LOGGER.warn("Ignoring <relation> \"{}\" with {} endpoint(s)", type, endpoints.size());
			return List.of();
		}
		Optional<Entity> from = entities.findByXmlId(endpoints.get(0));
		Optional<Entity> to = entities.findByXmlId(endpoints.get(1));
		if (from.isEmpty() || to.isEmpty()) {
			LOGGER.warn("Ignoring <relation> \"{}\" between unknown entities {}", type, endpoints);
			return List.of();
		}
		Identifier id = Identifier.from(relation.attribute("xml:id")
			.orElse(EntityType.RELATIONSHIP.idPrefix() + "-" + Slugs.slug(type) + "-" + endpoints.get(0) + "-" + endpoints.get(1)));
		Relationship primary = new Relationship(id, from.get().id(), to.get().id(), type, subtype, mutual);
		return mutual ? List.of(primary, primary.reciprocal()) : List.of(primary);
	}

	private static List<String> references(String attributeValue) {
		return stripReferences(attributeValue)
			.map(s -> Arrays.asList(s.split(" ")))
			.orElse(List.of());
	}

	static final String ARCHIVED_ATTRIBUTE = "status";
	static final String ARCHIVED_VALUE = "archived";
	static final String DEFAULT_RELATION_TYPE = "related";

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentParser.class);
}
