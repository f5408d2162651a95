package works.quill.validation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.document.Document;
import works.quill.entities.Entity;
import works.quill.markup.Element;
import works.quill.markup.Node;
import works.quill.markup.Text;
import works.quill.schema.AttributeConstraint;
import works.quill.schema.AttributeType;
import works.quill.schema.ConstraintTable;
import works.quill.schema.ContentModel;
import works.quill.schema.TagConstraint;

import static works.quill.validation.IssueCode.ARCHIVED_REFERENCE;
import static works.quill.validation.IssueCode.CONTENT_MODEL_VIOLATION;
import static works.quill.validation.IssueCode.INVALID_ATTR_VALUE;
import static works.quill.validation.IssueCode.MISSING_REQUIRED_ATTR;
import static works.quill.validation.IssueCode.UNDECLARED_ATTRIBUTE;
import static works.quill.validation.IssueCode.UNEXPECTED_TEXT;
import static works.quill.validation.IssueCode.UNKNOWN_ELEMENT;
import static works.quill.validation.IssueCode.UNRESOLVED_IDREF;
import static works.quill.validation.Severity.CRITICAL;
import static works.quill.validation.Severity.INFO;
import static works.quill.validation.Severity.WARNING;

/**
 * Checks a whole document's markup against one {@link ConstraintTable}.
 * <p>
 * Unknown elements, missing required attributes, disallowed enumerated values,
 * unresolved pointers and disallowed children are {@link Severity#CRITICAL};
 * undeclared attributes and stray text are {@link Severity#WARNING}.
 * <code>xml:id</code> and namespace declarations are allowed everywhere.
 */
public final class DocumentValidator {
	public List<ValidationIssue> validate(Document document, ConstraintTable table) {
		Walk walk = new Walk(document, table, document.referenceTargets());
		Element root = document.tree();
		walk.visit(root, "/" + root.name());
		LOGGER.debug("Validated revision {}: {} issues", document.revision(), walk.issues.size());
		return walk.issues;
	}

	private static final class Walk {
		final Document document;
		final ConstraintTable table;
		final Set<String> targets;
		final List<ValidationIssue> issues = new ArrayList<>();

		Walk(Document document, ConstraintTable table, Set<String> targets) {
			this.document = document;
			this.table = table;
			this.targets = targets;
		}

		void visit(Element element, String path) {
			Optional<TagConstraint> constraint = table.tag(element.name());
			if (constraint.isEmpty()) {
				issue(CRITICAL, UNKNOWN_ELEMENT, "<" + element.name() + "> is not declared by the schema", path);
			} else {
				checkAttributes(element, constraint.get(), path);
				table.contentModel(element.name()).ifPresent(model -> checkContent(element, model, path));
			}
			Map<String, Integer> siblingCounts = new HashMap<>();
			element.childElements().forEach(child -> {
				int position = siblingCounts.merge(child.name(), 1, Integer::sum);
				visit(child, path + "/" + child.name() + "[" + position + "]");
			});
		}

		private void checkAttributes(Element element, TagConstraint constraint, String path) {
			for (String required: constraint.requiredAttributes()) {
				if (!element.attributes().containsKey(required)) {
					issue(CRITICAL, MISSING_REQUIRED_ATTR, "<" + element.name() + "> requires attribute " + required, path);
				}
			}
			element.attributes().forEach((name, value) -> {
				if (XML_ID.equals(name) || "xmlns".equals(name) || name.startsWith("xmlns:")) {
					return;
				}
				Optional<AttributeConstraint> attribute = table.attribute(element.name(), name);
				if (attribute.isEmpty()) {
					issue(WARNING, UNDECLARED_ATTRIBUTE, "<" + element.name() + "> does not declare attribute " + name, path);
				} else if (!attribute.get().allows(value)) {
					issue(CRITICAL, INVALID_ATTR_VALUE, name + "=\"" + value + "\" is not one of " + attribute.get().allowedValues(), path);
				} else if (attribute.get().type() == AttributeType.IDREF) {
					checkReferences(name, value, path);
				}
			});
		}

		private void checkReferences(String attributeName, String value, String path) {
			for (String token: value.trim().split("\\s+")) {
				String key = token.startsWith("#") ? token.substring(1) : token;
				if (key.isEmpty()) {
					continue;
				}
				if (!targets.contains(key)) {
					issue(CRITICAL, UNRESOLVED_IDREF, attributeName + " refers to unknown \"" + token + "\"", path);
				} else {
					document.entities().resolve(key)
						.filter(Entity::archived)
						.ifPresent(e -> issue(INFO, ARCHIVED_REFERENCE, attributeName + " refers to archived " + e.id(), path));
				}
			}
		}

		private void checkContent(Element element, ContentModel model, String path) {
			boolean strayText = false;
			for (Node child: element.children()) {
				if (child instanceof Element e) {
					if (!model.allowsChild(e.name())) {
						issue(CRITICAL, CONTENT_MODEL_VIOLATION, "<" + e.name() + "> is not allowed inside <" + element.name() + ">", path);
					}
				} else if (child instanceof Text t && !t.isBlank() && !model.allowsText()) {
					strayText = true;
				}
			}
			if (strayText) {
				issue(WARNING, UNEXPECTED_TEXT, "<" + element.name() + "> should not contain text", path);
			}
		}

		private void issue(Severity severity, IssueCode code, String message, String path) {
			issues.add(new ValidationIssue(severity, code, message, path));
		}
	}

	private static final String XML_ID = "xml:id";

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentValidator.class);
}
