package works.quill.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.document.Document;
import works.quill.document.Passage;
import works.quill.document.Tag;
import works.quill.document.TextRange;
import works.quill.entities.DeleteEntity;
import works.quill.entities.Entity;
import works.quill.entities.EntityOperations;
import works.quill.entities.EntityType;
import works.quill.entities.Slugs;
import works.quill.exceptions.ValidationException;
import works.quill.mutation.AddTag;
import works.quill.mutation.ChangeEntities;
import works.quill.mutation.ChangeTagAttributes;
import works.quill.mutation.Mutation;
import works.quill.mutation.MutationVisitor;
import works.quill.mutation.RemoveTag;
import works.quill.mutation.RestoreEntities;
import works.quill.schema.AttributeConstraint;
import works.quill.schema.AttributeType;
import works.quill.schema.ConstraintTable;
import works.quill.schema.ContentModel;
import works.quill.schema.TagConstraint;

import static works.quill.validation.ErrorCode.CONTENT_MODEL_VIOLATION;
import static works.quill.validation.ErrorCode.DUPLICATE_TAG;
import static works.quill.validation.ErrorCode.ENTITY_REFERENCED;
import static works.quill.validation.ErrorCode.INVALID_ATTR_VALUE;
import static works.quill.validation.ErrorCode.MISSING_REQUIRED_ATTR;
import static works.quill.validation.ErrorCode.PASSAGE_NOT_FOUND;
import static works.quill.validation.ErrorCode.RANGE_OUT_OF_BOUNDS;
import static works.quill.validation.ErrorCode.SPLITS_EXISTING_TAG;
import static works.quill.validation.ErrorCode.TAG_NOT_FOUND;
import static works.quill.validation.ErrorCode.UNKNOWN_TAG_TYPE;
import static works.quill.validation.ErrorCode.UNRESOLVED_IDREF;

/**
 * Decides whether a {@link Mutation} may be applied to a {@link Document}.
 * <p>
 * Checks run in a fixed order and the first failure is reported.
 * For a new tag: the passage exists, the range fits, the type is declared,
 * required attributes are present, enumerated and pointer attributes are valid,
 * the tag isn't a duplicate, it doesn't cross an existing tag, and the
 * content models of its new parent and children allow it.
 */
public final class MutationValidator {
	public void validate(Document document, ConstraintTable table, Mutation mutation) throws ValidationException {
		Optional<ValidationError> error = new Checker(document, table).visit(mutation);
		if (error.isPresent()) {
			LOGGER.debug("Rejected {}: {}", mutation.getClass().getSimpleName(), error.get());
			throw new ValidationException(error.get());
		}
	}

	private static final class Checker implements MutationVisitor<Optional<ValidationError>> {
		final Document document;
		final ConstraintTable table;
		Set<String> referenceTargets; // Computed on first use

		Checker(Document document, ConstraintTable table) {
			this.document = document;
			this.table = table;
		}

		@Override
		public Optional<ValidationError> visitAddTag(AddTag m) {
			Optional<Passage> found = document.passage(m.passageId());
			if (found.isEmpty()) {
				return passageNotFound(m.passageId().toString());
			}
			Passage passage = found.get();
			int length = passage.content().length();
			if (!m.range().fitsWithin(length)) {
				return error(RANGE_OUT_OF_BOUNDS, "Range " + m.range() + " exceeds passage length " + length,
					new Fix.ExpandSelection(m.range().clampedTo(length)));
			}
			Tag proposed = Tag.unplaced(m.type(), m.attributes(), m.range());
			return checkType(m.type())
				.or(() -> checkAttributes(m.type(), m.attributes()))
				.or(() -> checkDuplicate(passage, proposed, null))
				.or(() -> checkCrossing(passage, m.range()))
				.or(() -> checkContentModels(passage, proposed));
		}

		@Override
		public Optional<ValidationError> visitRemoveTag(RemoveTag m) {
			Optional<Passage> passage = document.passage(m.passageId());
			if (passage.isEmpty()) {
				return passageNotFound(m.passageId().toString());
			} else if (passage.get().tag(m.tagId()).isEmpty()) {
				return error(TAG_NOT_FOUND, "No tag \"" + m.tagId() + "\" in passage \"" + m.passageId() + "\"");
			} else {
				return Optional.empty();
			}
		}

		@Override
		public Optional<ValidationError> visitChangeTagAttributes(ChangeTagAttributes m) {
			Optional<Passage> passage = document.passage(m.passageId());
			if (passage.isEmpty()) {
				return passageNotFound(m.passageId().toString());
			}
			Optional<Tag> tag = passage.get().tag(m.tagId());
			if (tag.isEmpty()) {
				return error(TAG_NOT_FOUND, "No tag \"" + m.tagId() + "\" in passage \"" + m.passageId() + "\"");
			}
			Tag changed = tag.get().withAttributes(m.attributes());
			return checkType(changed.type())
				.or(() -> checkAttributes(changed.type(), changed.attributes()))
				.or(() -> checkDuplicate(passage.get(), changed, tag.get()));
		}

		@Override
		public Optional<ValidationError> visitChangeEntities(ChangeEntities m) {
			Optional<ValidationError> error = EntityOperations.check(document.entities(), m.delta());
			if (error.isPresent()) {
				return error;
			} else if (m.delta() instanceof DeleteEntity d) {
				return checkTagReferences(d.entity());
			} else {
				return Optional.empty();
			}
		}

		@Override
		public Optional<ValidationError> visitRestoreEntities(RestoreEntities m) {
			return Optional.empty();
		}

		private Optional<ValidationError> checkType(String type) {
			if (table.declares(type)) {
				return Optional.empty();
			}
			return error(UNKNOWN_TAG_TYPE, "<" + type + "> is not declared by the schema");
		}

		private Optional<ValidationError> checkAttributes(String type, Map<String, String> attributes) {
			TagConstraint constraint = table.tag(type).orElseThrow();
			for (String required: constraint.requiredAttributes()) {
				if (!attributes.containsKey(required)) {
					AttributeConstraint attribute = table.attribute(type, required).orElseThrow();
					List<String> suggestions = attribute.type() == AttributeType.IDREF
						? activeReferences()
						: attribute.allowedValues();
					return error(MISSING_REQUIRED_ATTR, "<" + type + "> requires attribute " + required,
						new Fix.AddAttribute(required, attribute.defaultValue(), suggestions));
				}
			}
			for (Map.Entry<String, String> entry: attributes.entrySet()) {
				Optional<AttributeConstraint> attribute = table.attribute(type, entry.getKey());
				if (attribute.isPresent() && !attribute.get().allows(entry.getValue())) {
					return error(INVALID_ATTR_VALUE, entry.getKey() + "=\"" + entry.getValue() + "\" is not one of " + attribute.get().allowedValues(),
						new Fix.ChangeAttribute(entry.getKey(), entry.getValue(), attribute.get().allowedValues()));
				}
			}
			for (Map.Entry<String, String> entry: attributes.entrySet()) {
				Optional<AttributeConstraint> attribute = table.attribute(type, entry.getKey());
				if (attribute.isPresent() && attribute.get().type() == AttributeType.IDREF) {
					for (String token: entry.getValue().trim().split("\\s+")) {
						String key = token.startsWith("#") ? token.substring(1) : token;
						if (!key.isEmpty() && !referenceTargets().contains(key)) {
							return error(UNRESOLVED_IDREF, entry.getKey() + " refers to unknown \"" + token + "\"",
								new Fix.ChangeAttribute(entry.getKey(), entry.getValue(), activeReferences()),
								new Fix.CreateEntity(likelyEntityType(type), Slugs.slug(key)));
						}
					}
				}
			}
			return Optional.empty();
		}

		private Optional<ValidationError> checkDuplicate(Passage passage, Tag proposed, Tag replaced) {
			return passage.tags().stream()
				.filter(t -> t != replaced && t.isIdenticalTo(proposed))
				.findFirst()
				.flatMap(t -> error(DUPLICATE_TAG, "Passage \"" + passage.id() + "\" already has an identical <"
					+ t.type() + "> at " + t.range() + " (" + t.id() + ")"));
		}

		private Optional<ValidationError> checkCrossing(Passage passage, TextRange range) {
			return passage.tags().stream()
				.filter(t -> t.range().crosses(range))
				.findFirst()
				.flatMap(t -> error(SPLITS_EXISTING_TAG, "Range " + range + " would split <" + t.type() + "> "
						+ t.id() + " at " + t.range(),
					new Fix.ExpandSelection(range.union(t.range()))));
		}

		/**
		 * The new tag goes inside the innermost existing tag that encloses it, or directly in the passage,
		 * and it takes as children the outermost existing tags it encloses.
		 * Tags with exactly the new tag's range stay outside it.
		 */
		private Optional<ValidationError> checkContentModels(Passage passage, Tag proposed) {
			TextRange range = proposed.range();
			String parentType = passage.element();
			for (Tag t: passage.tags()) {
				if (t.range().encloses(range)) {
					parentType = t.type();
				}
			}
			Optional<ContentModel> parentModel = table.contentModel(parentType);
			if (parentModel.isPresent() && !parentModel.get().allowsChild(proposed.type())) {
				return error(CONTENT_MODEL_VIOLATION, "<" + proposed.type() + "> is not allowed inside <" + parentType + ">");
			}
			Optional<ContentModel> model = table.contentModel(proposed.type());
			if (model.isEmpty()) {
				return Optional.empty();
			}
			List<Tag> children = new ArrayList<>();
			for (Tag t: passage.tags()) {
				if (range.encloses(t.range()) && !t.range().equals(range)
					&& children.stream().noneMatch(c -> c.range().encloses(t.range()))) {
					children.add(t);
				}
			}
			for (Tag child: children) {
				if (!model.get().allowsChild(child.type())) {
					return error(CONTENT_MODEL_VIOLATION, "<" + child.type() + "> " + child.id() + " is not allowed inside <" + proposed.type() + ">");
				}
			}
			if (!model.get().allowsText() && hasUncoveredText(passage.content(), range, children)) {
				return error(CONTENT_MODEL_VIOLATION, "<" + proposed.type() + "> may not contain text");
			}
			return Optional.empty();
		}

		private static boolean hasUncoveredText(String content, TextRange range, List<Tag> children) {
			for (int i = range.start(); i < range.end(); i++) {
				int position = i;
				boolean covered = children.stream().anyMatch(c -> c.range().start() <= position && position < c.range().end());
				if (!covered && !java.lang.Character.isWhitespace(content.charAt(i))) {
					return true;
				}
			}
			return false;
		}

		/**
		 * Deleting an entity is refused while any tag points at it; archiving is the alternative.
		 * A <code>#</code> pointer counts in any attribute, and a bare xmlId or id
		 * counts in attributes the schema types as pointers.
		 */
		private Optional<ValidationError> checkTagReferences(Entity entity) {
			for (Passage passage: document.passages()) {
				for (Tag tag: passage.tags()) {
					for (Map.Entry<String, String> attribute: tag.attributes().entrySet()) {
						if (XML_ID.equals(attribute.getKey())) {
							continue;
						}
						boolean pointer = table.attribute(tag.type(), attribute.getKey())
							.filter(a -> a.type() == AttributeType.IDREF)
							.isPresent();
						for (String token: attribute.getValue().trim().split("\\s+")) {
							boolean candidate = pointer || token.startsWith("#");
							if (candidate && document.entities().resolve(token).filter(e -> e.id().equals(entity.id())).isPresent()) {
								return error(ENTITY_REFERENCED, "\"" + entity.id() + "\" is referenced by <" + tag.type() + "> "
										+ tag.id() + " (" + attribute.getKey() + "=\"" + attribute.getValue() + "\") in passage \"" + passage.id() + "\"",
									new Fix.ArchiveEntity(entity.id()));
							}
						}
					}
				}
			}
			return Optional.empty();
		}

		private Set<String> referenceTargets() {
			if (referenceTargets == null) {
				referenceTargets = document.referenceTargets();
			}
			return referenceTargets;
		}

		private List<String> activeReferences() {
			return document.entities().entities()
				.filter(e -> !e.archived())
				.map(Entity::reference)
				.toList();
		}

		private static EntityType likelyEntityType(String tagType) {
			switch (tagType) {
				case "placeName": return EntityType.PLACE;
				case "orgName": return EntityType.ORGANIZATION;
				default: return EntityType.CHARACTER;
			}
		}

		private static Optional<ValidationError> passageNotFound(String passageId) {
			return error(PASSAGE_NOT_FOUND, "No passage \"" + passageId + "\"");
		}

		private static Optional<ValidationError> error(ErrorCode code, String message, Fix... fixes) {
			return Optional.of(ValidationError.of(code, message, fixes));
		}
	}

	private static final String XML_ID = "xml:id";
	private static final Logger LOGGER = LoggerFactory.getLogger(MutationValidator.class);
}
