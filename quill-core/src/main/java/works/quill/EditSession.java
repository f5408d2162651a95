package works.quill;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.document.Document;
import works.quill.document.DocumentSerializer;
import works.quill.document.TextRange;
import works.quill.entities.Character;
import works.quill.entities.CreateEntity;
import works.quill.entities.Entity;
import works.quill.entities.EntityDelta;
import works.quill.entities.EntityOperations;
import works.quill.entities.Organization;
import works.quill.entities.Place;
import works.quill.entities.Relate;
import works.quill.entities.Relationship;
import works.quill.exceptions.ValidationException;
import works.quill.history.DeltaLog;
import works.quill.history.HistoryStep;
import works.quill.history.UndoRedoEngine;
import works.quill.logging.DiagnosticContext.DiagnosticScope;
import works.quill.logging.MdcKeys;
import works.quill.mutation.AddTag;
import works.quill.mutation.ChangeEntities;
import works.quill.mutation.ChangeTagAttributes;
import works.quill.mutation.DocumentEditor;
import works.quill.mutation.DocumentEvent;
import works.quill.mutation.Mutation;
import works.quill.mutation.RemoveTag;
import works.quill.mutation.RestoreEntities;
import works.quill.validation.ErrorCode;
import works.quill.validation.ProgressiveValidator;
import works.quill.validation.ValidationError;
import works.quill.validation.ValidationReport;

import static works.quill.logging.DiagnosticContext.withAttributes;

/**
 * Holds the current revision of one document together with its entity history.
 * <p>
 * A session has a single writer. It does no locking of its own,
 * so callers sharing a session across threads must serialize their calls.
 * A rejected mutation leaves the session exactly as it was.
 */
public final class EditSession {
	@Getter private final String name;
	private final DocumentEditor editor;
	private final UndoRedoEngine history;
	private final ProgressiveValidator validator;
	private final List<String> schemaOrder;
	private final DocumentSerializer serializer;
	@Getter private final EntityOperations entityOperations;

	@Getter private Document document;
	@Getter private DeltaLog log;
	private final List<DocumentEvent> events = new ArrayList<>();

	EditSession(
		String name,
		Document document,
		DocumentEditor editor,
		UndoRedoEngine history,
		ProgressiveValidator validator,
		List<String> schemaOrder,
		DocumentSerializer serializer,
		EntityOperations entityOperations
	) {
		this.name = name;
		this.document = document;
		this.editor = editor;
		this.history = history;
		this.validator = validator;
		this.schemaOrder = List.copyOf(schemaOrder);
		this.serializer = serializer;
		this.entityOperations = entityOperations;
		this.log = DeltaLog.startingFrom(document.entities());
	}

	/**
	 * Every committed mutation in order, oldest first.
	 */
	public List<DocumentEvent> events() {
		return List.copyOf(events);
	}

	public Document addTag(Identifier passageId, TextRange range, String type, Map<String, String> attributes) throws ValidationException {
		return applyTagMutation(new AddTag(passageId, range, type, attributes));
	}

	public Document removeTag(Identifier passageId, Identifier tagId) throws ValidationException {
		return applyTagMutation(new RemoveTag(passageId, tagId));
	}

	public Document changeTagAttributes(Identifier passageId, Identifier tagId, Map<String, String> attributes) throws ValidationException {
		return applyTagMutation(new ChangeTagAttributes(passageId, tagId, attributes));
	}

	private Document applyTagMutation(Mutation mutation) throws ValidationException {
		try (var __ = scope()) {
			Document next = editor.apply(document, mutation);
			commit(next, log, mutation);
			return next;
		}
	}

	/**
	 * Applies <code>delta</code> to the document's entities and records it so it can be undone.
	 */
	public Document applyEntityDelta(EntityDelta delta) throws ValidationException {
		try (var __ = scope()) {
			Document next = editor.applyEntityDelta(document, delta);
			HistoryStep step = history.apply(log, delta);
			commit(next, step.log(), new ChangeEntities(delta));
			return next;
		}
	}

	public Character createCharacter(String characterName) throws ValidationException {
		CreateEntity delta = entityOperations.createCharacter(characterName);
		applyEntityDelta(delta);
		return (Character) delta.entity();
	}

	public Place createPlace(String placeName) throws ValidationException {
		CreateEntity delta = entityOperations.createPlace(placeName);
		applyEntityDelta(delta);
		return (Place) delta.entity();
	}

	public Organization createOrganization(String organizationName) throws ValidationException {
		CreateEntity delta = entityOperations.createOrganization(organizationName);
		applyEntityDelta(delta);
		return (Organization) delta.entity();
	}

	public Document updateEntity(Entity entity) throws ValidationException {
		return applyEntityDelta(entityOperations.update(entity));
	}

	public Document archiveEntity(Identifier entityId) throws ValidationException {
		return applyEntityDelta(entityOperations.archive(existingEntity(entityId)));
	}

	public Document deleteEntity(Identifier entityId) throws ValidationException {
		return applyEntityDelta(entityOperations.delete(existingEntity(entityId)));
	}

	public Relationship addRelationship(Identifier from, Identifier to, String type, boolean mutual) throws ValidationException {
		Relate delta = entityOperations.relate(from, to, type, mutual);
		applyEntityDelta(delta);
		return delta.relationship();
	}

	public Document removeRelationship(Identifier relationshipId) throws ValidationException {
		Relationship relationship = document.entities().relationships().get(relationshipId);
		if (relationship == null) {
			throw new ValidationException(ValidationError.of(ErrorCode.ENTITY_NOT_FOUND,
				"No relationship with id \"" + relationshipId + "\""));
		}
		return applyEntityDelta(entityOperations.unrelate(relationship));
	}

	private Entity existingEntity(Identifier entityId) throws ValidationException {
		return document.entities().find(entityId)
			.orElseThrow(() -> new ValidationException(ValidationError.of(ErrorCode.ENTITY_NOT_FOUND,
				"No entity with id \"" + entityId + "\"")));
	}

	/**
	 * Steps back over the most recent entity change, producing a new revision.
	 *
	 * @return false if there was nothing to undo
	 */
	public boolean undo() {
		try (var __ = scope()) {
			return restore(history.undo(log), "undo");
		}
	}

	/**
	 * @return false if there was nothing to redo
	 */
	public boolean redo() {
		try (var __ = scope()) {
			return restore(history.redo(log), "redo");
		}
	}

	private boolean restore(HistoryStep step, String reason) {
		if (!step.changed()) {
			LOGGER.debug("Nothing to {}", reason);
			return false;
		}
		RestoreEntities mutation = new RestoreEntities(step.entities(), reason);
		Document next;
		try {
			next = editor.apply(document, mutation);
		} catch (ValidationException e) {
			throw new IllegalStateException("Restoring entities should never be rejected", e);
		}
		commit(next, step.log(), mutation);
		return true;
	}

	public ValidationReport validate() {
		try (var __ = scope()) {
			return validator.validate(document, schemaOrder);
		}
	}

	public String serialize() {
		return serializer.serialize(document);
	}

	private void commit(Document next, DeltaLog nextLog, Mutation mutation) {
		document = next;
		log = nextLog;
		events.add(new DocumentEvent(next.revision(), Instant.now(), mutation));
		LOGGER.debug("Committed revision {}", next.revision());
	}

	private DiagnosticScope scope() {
		return withAttributes(Map.of(
			MdcKeys.DOCUMENT, name,
			MdcKeys.REVISION, Long.toString(document.revision())));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EditSession.class);
}
