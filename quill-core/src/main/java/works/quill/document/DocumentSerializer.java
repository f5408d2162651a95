package works.quill.document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import works.quill.entities.Character;
import works.quill.entities.Entity;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityType;
import works.quill.entities.EntityVisitor;
import works.quill.entities.Organization;
import works.quill.entities.Place;
import works.quill.entities.Relationship;
import works.quill.markup.Element;
import works.quill.markup.MarkupWriter;
import works.quill.markup.Node;
import works.quill.markup.Text;

import static works.quill.document.DocumentParser.ARCHIVED_ATTRIBUTE;
import static works.quill.document.DocumentParser.ARCHIVED_VALUE;

/**
 * Renders a {@link Document}'s current state as markup.
 * <p>
 * The document's tree supplies everything the indices don't describe
 * (the header, the structure between passages, any foreign standOff content).
 * Each passage element's content is rebuilt from the passage's text and tags,
 * and the entity lists are rebuilt from the entity collection.
 * Parsing the output yields the same passages, tags, dialogue and entities.
 */
@RequiredArgsConstructor
public final class DocumentSerializer {
	private final ParserConfiguration configuration;

	public String serialize(Document document) {
		return MarkupWriter.write(render(document));
	}

	public Element render(Document document) {
		Iterator<Passage> passages = document.passages().iterator();
		Element tree = document.tree();
		Element root;
		if (configuration.blockElements().contains(tree.name())) {
			if (!passages.hasNext()) {
				throw new IllegalStateException("Document tree has more blocks than passages");
			}
			root = tree.withChildren(renderPassage(passages.next()));
		} else {
			root = replaceBlocks(tree, passages);
		}
		if (passages.hasNext()) {
			throw new IllegalStateException("Document has more passages than its tree has blocks");
		}
		return withStandOff(root, document.entities());
	}

	private Element replaceBlocks(Element element, Iterator<Passage> passages) {
		List<Node> newChildren = new ArrayList<>(element.children().size());
		for (Node child: element.children()) {
			if (child instanceof Element e && !configuration.skippedSections().contains(e.name())) {
				if (configuration.blockElements().contains(e.name())) {
					if (!passages.hasNext()) {
						throw new IllegalStateException("Document tree has more blocks than passages");
					}
					newChildren.add(e.withChildren(renderPassage(passages.next())));
				} else {
					newChildren.add(replaceBlocks(e, passages));
				}
			} else {
				newChildren.add(child);
			}
		}
		return element.withChildren(newChildren);
	}

	/**
	 * Tags are in canonical order, which is the order their elements open,
	 * so a stack of open elements is enough to nest them.
	 */
	static List<Node> renderPassage(Passage passage) {
		String content = passage.content();
		Deque<OpenTag> stack = new ArrayDeque<>();
		List<Node> top = new ArrayList<>();
		int position = 0;
		for (Tag tag: passage.tags()) {
			while (!stack.isEmpty() && !holds(stack.peek().tag, tag)) {
				position = close(stack, top, content, position);
			}
			List<Node> current = stack.isEmpty() ? top : stack.peek().children;
			position = appendText(current, content, position, tag.range().start());
			stack.push(new OpenTag(tag, new ArrayList<>()));
		}
		while (!stack.isEmpty()) {
			position = close(stack, top, content, position);
		}
		appendText(top, content, position, content.length());
		return top;
	}

	private record OpenTag(Tag tag, List<Node> children) { }

	/**
	 * An empty element holds nothing, so adjacent empty tags stay siblings.
	 */
	private static boolean holds(Tag outer, Tag inner) {
		return !outer.range().isEmpty() && outer.range().encloses(inner.range());
	}

	private static int close(Deque<OpenTag> stack, List<Node> top, String content, int position) {
		OpenTag closing = stack.pop();
		int end = closing.tag.range().end();
		position = appendText(closing.children, content, position, end);
		Element element = new Element(closing.tag.type(), closing.tag.attributes(), closing.children);
		(stack.isEmpty() ? top : stack.peek().children).add(element);
		return position;
	}

	private static int appendText(List<Node> children, String content, int position, int upTo) {
		if (upTo > position) {
			children.add(new Text(content.substring(position, upTo)));
			return upTo;
		} else {
			return position;
		}
	}

	/**
	 * A lone passage can't hold a standOff without changing its text,
	 * so when one needs entity lists it's wrapped in a {@value #WRAPPER} root.
	 */
	private Element withStandOff(Element root, EntityCollection entities) {
		List<Element> lists = entityLists(entities);
		Element existing = root.firstChild(STAND_OFF).orElse(null);
		if (existing == null) {
			if (lists.isEmpty()) {
				return root;
			}
			Element standOff = new Element(STAND_OFF, Map.of(), new ArrayList<>(lists));
			if (configuration.blockElements().contains(root.name())) {
				return Element.of(WRAPPER, root, standOff);
			} else {
				return root.withChildren(append(root.children(), standOff));
			}
		}
		Element cleared = existing.withoutChildren(e -> ENTITY_LISTS.contains(e.name()));
		List<Node> newChildren = new ArrayList<>(cleared.children());
		newChildren.addAll(lists);
		return root.withChildReplaced(e -> e == existing, cleared.withChildren(newChildren));
	}

	private static List<Node> append(List<Node> nodes, Node extra) {
		List<Node> result = new ArrayList<>(nodes);
		result.add(extra);
		return result;
	}

	private static List<Element> entityLists(EntityCollection entities) {
		List<Element> lists = new ArrayList<>();
		EntityRenderer renderer = new EntityRenderer();
		addList(lists, EntityType.CHARACTER, entities.characters().stream().map(renderer::visit).toList());
		addList(lists, EntityType.PLACE, entities.places().stream().map(renderer::visit).toList());
		addList(lists, EntityType.ORGANIZATION, entities.organizations().stream().map(renderer::visit).toList());
		addList(lists, EntityType.RELATIONSHIP, entities.relationships().stream()
			.filter(r -> !r.isReciprocal())
			.map(r -> renderRelationship(r, entities))
			.toList());
		return lists;
	}

	private static void addList(List<Element> lists, EntityType type, List<Element> members) {
		if (!members.isEmpty()) {
			lists.add(new Element(type.listElementName(), Map.of(), new ArrayList<>(members)));
		}
	}

	private static final class EntityRenderer implements EntityVisitor<Element> {
		@Override
		public Element visitCharacter(Character c) {
			List<Node> children = new ArrayList<>();
			children.add(Element.of("persName", new Text(c.name())));
			c.sex().ifPresent(v -> children.add(Element.of("sex", Map.of("value", v))));
			c.age().ifPresent(v -> children.add(Element.of("age", Map.of("value", v.toString()))));
			c.occupation().ifPresent(v -> children.add(Element.of("occupation", new Text(v))));
			c.traits().forEach(v -> children.add(Element.of("trait", Element.of("desc", new Text(v)))));
			c.socialStatus().ifPresent(v -> children.add(Element.of("socecStatus", new Text(v))));
			c.maritalStatus().ifPresent(v -> children.add(Element.of("state", Map.of("type", "marital"), Element.of("desc", new Text(v)))));
			return new Element(EntityType.CHARACTER.elementName(), attributesOf(c), children);
		}

		@Override
		public Element visitPlace(Place p) {
			List<Node> children = new ArrayList<>();
			children.add(Element.of("placeName", new Text(p.name())));
			p.country().ifPresent(v -> children.add(Element.of("country", new Text(v))));
			p.coordinates().ifPresent(v -> children.add(Element.of("location", Element.of("geo", new Text(v)))));
			return new Element(EntityType.PLACE.elementName(), attributesOf(p), children);
		}

		@Override
		public Element visitOrganization(Organization o) {
			Map<String, String> attributes = attributesOf(o);
			o.orgType().ifPresent(v -> attributes.put("type", v));
			return new Element(EntityType.ORGANIZATION.elementName(), attributes, List.of(Element.of("orgName", new Text(o.name()))));
		}

		private static Map<String, String> attributesOf(Entity entity) {
			Map<String, String> attributes = new LinkedHashMap<>();
			attributes.put("xml:id", entity.xmlId());
			if (entity.archived()) {
				attributes.put(ARCHIVED_ATTRIBUTE, ARCHIVED_VALUE);
			}
			return attributes;
		}
	}

	private static Element renderRelationship(Relationship r, EntityCollection entities) {
		String from = referenceTo(r.from(), entities);
		String to = referenceTo(r.to(), entities);
		Map<String, String> attributes = new LinkedHashMap<>();
		attributes.put("xml:id", r.id().toString());
		attributes.put("name", r.type());
		r.subtype().ifPresent(v -> attributes.put("subtype", v));
		if (r.mutual()) {
			attributes.put("mutual", from + " " + to);
		} else {
			attributes.put("active", from);
			attributes.put("passive", to);
		}
		return new Element(EntityType.RELATIONSHIP.elementName(), attributes, List.of());
	}

	private static String referenceTo(works.quill.Identifier entityId, EntityCollection entities) {
		return entities.find(entityId)
			.map(Entity::reference)
			.orElseThrow(() -> new IllegalStateException("Relationship refers to missing entity " + entityId));
	}

	private static final String STAND_OFF = "standOff";
	private static final String WRAPPER = "TEI";
	private static final Set<String> ENTITY_LISTS = Set.of(
		EntityType.CHARACTER.listElementName(),
		EntityType.PLACE.listElementName(),
		EntityType.ORGANIZATION.listElementName(),
		EntityType.RELATIONSHIP.listElementName());
}
