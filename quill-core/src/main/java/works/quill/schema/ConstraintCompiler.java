package works.quill.schema;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.exceptions.ParseException;
import works.quill.exceptions.SchemaParseException;
import works.quill.markup.Element;
import works.quill.markup.MarkupReader;
import works.quill.schema.CompilationWarning.Kind;

import static works.quill.schema.CompilationWarning.Kind.DEFAULTED_TO_TEXT;
import static works.quill.schema.CompilationWarning.Kind.UNRECOGNIZED_PATTERN;
import static works.quill.schema.CompilationWarning.Kind.UNRESOLVED_REF;

/**
 * Reduces a RELAX NG grammar (XML syntax) to a {@link ConstraintTable}.
 * <p>
 * This is a deliberately partial reading of RELAX NG: it records, per element name,
 * which attributes are required or optional, enumerated attribute values,
 * attribute datatypes, and which children and text are allowed.
 * It does not check ordering or cardinality.
 * Anything it can't interpret is reported as a {@link CompilationWarning} rather than ignored.
 * <p>
 * Not thread-safe; use one instance per compilation, or call {@link #compile} from one thread at a time.
 */
public final class ConstraintCompiler {
	private static final Set<String> REQUIRING = Set.of("group", "interleave", "oneOrMore");
	private static final Set<String> OPTIONAL = Set.of("optional", "zeroOrMore", "choice");
	private static final Set<String> KEYWORDS = Set.of(
		"grammar", "start", "define", "element", "attribute", "ref", "text", "empty", "mixed",
		"data", "value", "param", "except", "name", "anyName", "nsName", "list", "parentRef",
		"externalRef", "notAllowed", "include", "div", "group", "interleave", "oneOrMore",
		"optional", "zeroOrMore", "choice");

	private Map<String, List<Element>> defines;
	private Set<Element> compiled;
	private Deque<Element> pending;
	private Map<String, List<Definition>> definitions;
	private List<CompilationWarning> warnings;

	public ConstraintTable compile(String grammar) throws SchemaParseException {
		return compile("<inline>", grammar);
	}

	public ConstraintTable compile(String schemaId, String grammar) throws SchemaParseException {
		Element root;
		try {
			root = MarkupReader.read(grammar);
		} catch (ParseException e) {
			throw new SchemaParseException(schemaId, "Schema \"" + schemaId + "\" is not well-formed: " + e.getMessage(), e);
		}
		if (!"grammar".equals(localName(root))) {
			throw new SchemaParseException(schemaId, "Schema \"" + schemaId + "\" has root <" + root.name() + ">; expected <grammar>");
		}

		defines = new LinkedHashMap<>();
		compiled = Collections.newSetFromMap(new IdentityHashMap<>());
		pending = new ArrayDeque<>();
		definitions = new LinkedHashMap<>();
		warnings = new ArrayList<>();

		List<Element> topLevel = new ArrayList<>();
		collectTopLevel(root, topLevel);
		for (Element pattern: topLevel) {
			findElements(pattern, new HashSet<>());
		}
		while (!pending.isEmpty()) {
			compileElement(pending.pop());
		}

		ConstraintTable result = buildTable();
		LOGGER.debug("Compiled \"{}\": {} elements, {} warnings", schemaId, result.tagNames().size(), warnings.size());
		return result;
	}

	/**
	 * Gathers <code>start</code> and <code>define</code> patterns, looking inside <code>div</code>.
	 * Defines with the same name are combined.
	 */
	private void collectTopLevel(Element grammar, List<Element> topLevel) {
		grammar.childElements().forEach(child -> {
			switch (localName(child)) {
				case "start" -> topLevel.add(child);
				case "define" -> {
					String name = child.attribute("name").orElse("");
					defines.computeIfAbsent(name, n -> new ArrayList<>()).add(child);
					topLevel.add(child);
				}
				case "div" -> collectTopLevel(child, topLevel);
				default -> unrecognized("grammar", child);
			}
		});
	}

	/**
	 * Finds every element pattern reachable from <code>pattern</code> without entering
	 * another element's content, and queues it for compilation.
	 */
	private void findElements(Element pattern, Set<String> visitingRefs) {
		pattern.childElements().forEach(child -> {
			String keyword = localName(child);
			if ("element".equals(keyword)) {
				enqueue(child);
			} else if ("ref".equals(keyword)) {
				String target = child.attribute("name").orElse("");
				if (visitingRefs.add(target)) {
					defines.getOrDefault(target, List.of()).forEach(d -> findElements(d, visitingRefs));
					visitingRefs.remove(target);
				}
			} else if (isPattern(child)) {
				findElements(child, visitingRefs);
			}
		});
	}

	private void enqueue(Element elementPattern) {
		if (compiled.add(elementPattern)) {
			pending.add(elementPattern);
		}
	}

	private void compileElement(Element elementPattern) {
		Optional<String> name = nameOf(elementPattern);
		if (name.isEmpty()) {
			warn(UNRECOGNIZED_PATTERN, "grammar", "element pattern without a simple name");
			// Still look for named elements inside it
			findElements(elementPattern, new HashSet<>());
			return;
		}
		Definition definition = new Definition(name.get());
		walkContent(elementPattern, definition, false, new HashSet<>());
		definitions.computeIfAbsent(name.get(), n -> new ArrayList<>()).add(definition);
	}

	private void walkContent(Element pattern, Definition definition, boolean optional, Set<String> visitingRefs) {
		for (Element child: pattern.childElements().toList()) {
			String keyword = localName(child);
			if (!isPattern(child)) {
				continue;
			}
			switch (keyword) {
				case "name" -> {
					// Name class of the enclosing element or attribute; already consumed
				}
				case "attribute" -> addAttribute(child, definition, optional);
				case "element" -> {
					Optional<String> childName = nameOf(child);
					if (childName.isPresent()) {
						definition.children.add(childName.get());
					} else {
						warn(UNRECOGNIZED_PATTERN, definition.name, "child element without a simple name");
					}
					definition.hasContent = true;
					enqueue(child);
				}
				case "text", "data", "value", "list" -> {
					definition.text = true;
					definition.hasContent = true;
					if ("list".equals(keyword)) {
						warn(UNRECOGNIZED_PATTERN, definition.name, "<list> treated as text");
					}
				}
				case "mixed" -> {
					definition.text = true;
					definition.mixed = true;
					definition.hasContent = true;
					walkContent(child, definition, optional, visitingRefs);
				}
				case "empty" -> definition.hasContent = true;
				case "ref" -> {
					String target = child.attribute("name").orElse("");
					List<Element> targets = defines.get(target);
					if (targets == null) {
						warn(UNRESOLVED_REF, definition.name, "no definition named \"" + target + "\"");
					} else if (visitingRefs.add(target)) {
						for (Element define: targets) {
							walkContent(define, definition, optional, visitingRefs);
						}
						visitingRefs.remove(target);
					}
				}
				default -> {
					if (REQUIRING.contains(keyword)) {
						walkContent(child, definition, optional, visitingRefs);
					} else if (OPTIONAL.contains(keyword)) {
						walkContent(child, definition, true, visitingRefs);
					} else {
						unrecognized(definition.name, child);
					}
				}
			}
		}
	}

	private void addAttribute(Element attributePattern, Definition definition, boolean optional) {
		Optional<String> name = nameOf(attributePattern);
		if (name.isEmpty()) {
			warn(UNRECOGNIZED_PATTERN, definition.name, "attribute pattern without a simple name");
			return;
		}
		List<String> values = new ArrayList<>();
		collectValues(attributePattern, values);
		AttributeType type = values.isEmpty()
			? attributePattern.childElements().filter(e -> "data".equals(localName(e))).findFirst()
				.flatMap(d -> d.attribute("type"))
				.map(AttributeType::fromDatatype)
				.orElse(AttributeType.STRING)
			: AttributeType.ENUMERATED;
		definition.attributes.merge(
			name.get(),
			new AttributeConstraint(name.get(), type, !optional, values),
			ConstraintCompiler::mergeAttribute);
	}

	/**
	 * Enumerated values: <code>value</code> patterns directly inside the attribute or inside its <code>choice</code>s.
	 */
	private static void collectValues(Element pattern, List<String> values) {
		pattern.childElements().forEach(child -> {
			String keyword = localName(child);
			if ("value".equals(keyword)) {
				String value = child.textContent().trim();
				if (!values.contains(value)) {
					values.add(value);
				}
			} else if ("choice".equals(keyword)) {
				collectValues(child, values);
			}
		});
	}

	/**
	 * Mentioned twice within one definition: required if either mention is.
	 */
	private static AttributeConstraint mergeAttribute(AttributeConstraint a, AttributeConstraint b) {
		return new AttributeConstraint(a.name(), a.type(), a.required() || b.required(), unionOf(a.allowedValues(), b.allowedValues()));
	}

	private static List<String> unionOf(List<String> a, List<String> b) {
		Set<String> result = new LinkedHashSet<>(a);
		result.addAll(b);
		return new ArrayList<>(result);
	}

	/**
	 * Where an element is defined more than once, children and text permissions are unioned,
	 * and an attribute is required only if every definition requires it.
	 */
	private ConstraintTable buildTable() {
		Map<String, TagConstraint> tags = new LinkedHashMap<>();
		Map<String, Map<String, AttributeConstraint>> attributes = new LinkedHashMap<>();
		Map<String, ContentModel> contentModels = new LinkedHashMap<>();
		definitions.forEach((name, defs) -> {
			Map<String, AttributeConstraint> merged = new LinkedHashMap<>();
			for (Definition def: defs) {
				def.attributes.forEach((attrName, constraint) -> merged.merge(attrName, constraint, (a, b) ->
					new AttributeConstraint(a.name(), a.type(), a.required(), unionOf(a.allowedValues(), b.allowedValues()))));
			}
			merged.replaceAll((attrName, constraint) -> {
				boolean requiredEverywhere = defs.stream().allMatch(d ->
					d.attributes.containsKey(attrName) && d.attributes.get(attrName).required());
				return new AttributeConstraint(attrName, constraint.type(), requiredEverywhere, constraint.allowedValues());
			});
			List<String> required = new ArrayList<>();
			List<String> optional = new ArrayList<>();
			merged.values().forEach(c -> (c.required() ? required : optional).add(c.name()));
			tags.put(name, new TagConstraint(name, required, optional));
			attributes.put(name, merged);
			contentModels.put(name, contentModelOf(name, defs));
		});
		return ConstraintTable.of(tags, attributes, contentModels, warnings);
	}

	private ContentModel contentModelOf(String name, List<Definition> defs) {
		Set<String> children = new LinkedHashSet<>();
		boolean text = false;
		boolean mixed = false;
		boolean hasContent = false;
		boolean hasAttributes = false;
		for (Definition def: defs) {
			children.addAll(def.children);
			text |= def.text;
			mixed |= def.mixed;
			hasContent |= def.hasContent;
			hasAttributes |= !def.attributes.isEmpty();
		}
		if (mixed || (text && !children.isEmpty())) {
			return ContentModel.mixed(children);
		} else if (text) {
			return ContentModel.text();
		} else if (!children.isEmpty()) {
			return ContentModel.elements(children);
		} else if (hasContent || hasAttributes) {
			return ContentModel.empty();
		} else {
			warn(DEFAULTED_TO_TEXT, name, "no content pattern; assuming text");
			return ContentModel.text();
		}
	}

	private static Optional<String> nameOf(Element pattern) {
		Optional<String> attribute = pattern.attribute("name").map(String::trim).filter(s -> !s.isEmpty());
		if (attribute.isPresent()) {
			return attribute;
		}
		return pattern.childElements()
			.filter(e -> "name".equals(localName(e)))
			.findFirst()
			.map(e -> e.textContent().trim())
			.filter(s -> !s.isEmpty());
	}

	/**
	 * Prefixed elements that aren't grammar keywords are annotations, such as documentation.
	 */
	private static boolean isPattern(Element element) {
		return !element.name().contains(":") || KEYWORDS.contains(localName(element));
	}

	private void unrecognized(String context, Element pattern) {
		if (isPattern(pattern)) {
			warn(UNRECOGNIZED_PATTERN, context, "unsupported pattern <" + pattern.name() + ">");
		}
	}

	private void warn(Kind kind, String context, String message) {
		CompilationWarning warning = new CompilationWarning(kind, context, message);
		if (kind == DEFAULTED_TO_TEXT) {
			LOGGER.debug("{}", warning);
		} else {
			LOGGER.warn("{}", warning);
		}
		warnings.add(warning);
	}

	private static String localName(Element element) {
		String name = element.name();
		int colon = name.indexOf(':');
		return colon < 0 ? name : name.substring(colon + 1);
	}

	/**
	 * What one element pattern says about its element.
	 */
	private static final class Definition {
		final String name;
		final Map<String, AttributeConstraint> attributes = new LinkedHashMap<>();
		final Set<String> children = new LinkedHashSet<>();
		boolean text;
		boolean mixed;
		boolean hasContent;

		Definition(String name) {
			this.name = name;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintCompiler.class);
}
