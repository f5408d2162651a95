package works.quill.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * An element with a (possibly prefixed) name, attributes in document order,
 * and child nodes.
 */
public record Element(
	String name,
	Map<String, String> attributes,
	List<Node> children
) implements Node {
	public Element {
		requireNonNull(name);
		attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
		children = List.copyOf(children);
	}

	public static Element of(String name, Node... children) {
		return new Element(name, Map.of(), List.of(children));
	}

	public static Element of(String name, Map<String, String> attributes, Node... children) {
		return new Element(name, attributes, List.of(children));
	}

	public Optional<String> attribute(String attributeName) {
		return Optional.ofNullable(attributes.get(attributeName));
	}

	public Stream<Element> childElements() {
		return children.stream()
			.filter(Element.class::isInstance)
			.map(Element.class::cast);
	}

	public Stream<Element> childElements(String elementName) {
		return childElements().filter(e -> e.name.equals(elementName));
	}

	public Optional<Element> firstChild(String elementName) {
		return childElements(elementName).findFirst();
	}

	/**
	 * @return the trimmed text of the first child with the given name, if any.
	 */
	public Optional<String> childText(String elementName) {
		return firstChild(elementName)
			.map(Element::textContent)
			.map(String::trim)
			.filter(s -> !s.isEmpty());
	}

	@Override
	public String textContent() {
		StringBuilder sb = new StringBuilder();
		appendText(sb);
		return sb.toString();
	}

	private void appendText(StringBuilder sb) {
		for (Node child: children) {
			if (child instanceof Text t) {
				sb.append(t.value());
			} else if (child instanceof Element e) {
				e.appendText(sb);
			}
		}
	}

	public Element withChildren(List<? extends Node> newChildren) {
		return new Element(name, attributes, new ArrayList<>(newChildren));
	}

	public Element withAttribute(String attributeName, String value) {
		Map<String, String> newAttributes = new LinkedHashMap<>(attributes);
		newAttributes.put(attributeName, value);
		return new Element(name, newAttributes, children);
	}

	/**
	 * Replaces the first child element satisfying <code>predicate</code> with <code>replacement</code>,
	 * or appends <code>replacement</code> if there is no such child.
	 */
	public Element withChildReplaced(Predicate<Element> predicate, Element replacement) {
		List<Node> newChildren = new ArrayList<>(children);
		for (int i = 0; i < newChildren.size(); i++) {
			if (newChildren.get(i) instanceof Element e && predicate.test(e)) {
				newChildren.set(i, replacement);
				return withChildren(newChildren);
			}
		}
		newChildren.add(replacement);
		return withChildren(newChildren);
	}

	public Element withoutChildren(Predicate<Element> predicate) {
		List<Node> newChildren = new ArrayList<>(children.size());
		for (Node child: children) {
			if (!(child instanceof Element e && predicate.test(e))) {
				newChildren.add(child);
			}
		}
		return withChildren(newChildren);
	}
}
