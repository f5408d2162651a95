package works.quill.entities;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.Identifier;
import works.quill.exceptions.ValidationException;
import works.quill.validation.ErrorCode;
import works.quill.validation.Fix;
import works.quill.validation.ValidationError;

import static works.quill.validation.ErrorCode.DUPLICATE_ID;
import static works.quill.validation.ErrorCode.DUPLICATE_RELATIONSHIP;
import static works.quill.validation.ErrorCode.DUPLICATE_XML_ID;
import static works.quill.validation.ErrorCode.ENTITY_NOT_FOUND;
import static works.quill.validation.ErrorCode.ENTITY_REFERENCED;
import static works.quill.validation.ErrorCode.MISSING_NAME;
import static works.quill.validation.ErrorCode.XML_ID_CHANGED;

/**
 * Create, update, delete and relate operations on an {@link EntityCollection}.
 * <p>
 * The static methods check and apply {@link EntityDelta}s; they see only the collection,
 * so references from the document's tags are checked by the caller.
 * The instance methods build deltas stamped with this object's clock.
 */
@RequiredArgsConstructor
public final class EntityOperations {
	private final Clock clock;

	public static EntityOperations withSystemClock() {
		return new EntityOperations(Clock.systemUTC());
	}

	public CreateEntity create(Entity entity) {
		return new CreateEntity(entity, clock.instant());
	}

	public CreateEntity createCharacter(String name) {
		return create(Character.named(name));
	}

	public CreateEntity createPlace(String name) {
		return create(Place.named(name));
	}

	public CreateEntity createOrganization(String name) {
		return create(Organization.named(name));
	}

	public UpdateEntity update(Entity entity) {
		return new UpdateEntity(entity, clock.instant());
	}

	public UpdateEntity archive(Entity entity) {
		return update(entity.withArchived(true));
	}

	public DeleteEntity delete(Entity entity) {
		return new DeleteEntity(entity, clock.instant());
	}

	public Relate relate(Identifier from, Identifier to, String type, boolean mutual) {
		return relate(Relationship.between(from, to, type, mutual));
	}

	public Relate relate(Relationship relationship) {
		return new Relate(relationship, clock.instant());
	}

	public Unrelate unrelate(Relationship relationship) {
		return new Unrelate(relationship, clock.instant());
	}

	/**
	 * @throws ValidationException if <code>delta</code> can't be applied to <code>entities</code>
	 */
	public static void validate(EntityCollection entities, EntityDelta delta) throws ValidationException {
		Optional<ValidationError> error = check(entities, delta);
		if (error.isPresent()) {
			LOGGER.debug("Rejected {} of {}: {}", delta.op(), delta.entityType(), error.get());
			throw new ValidationException(error.get());
		}
	}

	/**
	 * @return the reason <code>delta</code> can't be applied to <code>entities</code>, if any
	 */
	public static Optional<ValidationError> check(EntityCollection entities, EntityDelta delta) {
		return new DeltaChecker(entities).visit(delta);
	}

	/**
	 * Validates <code>delta</code> and returns the collection it produces.
	 * Mutual relationships are added and removed as a pair,
	 * and deleting an entity removes the relationships it had with archived entities.
	 */
	public static EntityCollection applyEntityDelta(EntityCollection entities, EntityDelta delta) throws ValidationException {
		validate(entities, delta);
		EntityCollection result = new DeltaApplier(entities).visit(delta);
		LOGGER.trace("Applied {} of {}", delta.op(), delta.entityType());
		return result;
	}

	@RequiredArgsConstructor
	private static final class DeltaChecker implements DeltaVisitor<Optional<ValidationError>> {
		final EntityCollection entities;

		@Override
		public Optional<ValidationError> visitCreate(Entity entity, CreateEntity delta) {
			if (entity.name().isBlank()) {
				return error(MISSING_NAME, entity.entityType().externalName() + " must have a name");
			} else if (entities.contains(entity.id())) {
				return error(DUPLICATE_ID, "An entity with id \"" + entity.id() + "\" already exists");
			} else if (entities.findByXmlId(entity.xmlId()).isPresent()) {
				String suggestion = freeXmlId(entity.xmlId());
				return error(DUPLICATE_XML_ID, "An entity with xml:id \"" + entity.xmlId() + "\" already exists",
					new Fix.ChangeAttribute("xml:id", entity.xmlId(), List.of(suggestion)));
			} else {
				return Optional.empty();
			}
		}

		@Override
		public Optional<ValidationError> visitUpdate(Entity entity, UpdateEntity delta) {
			if (entity.name().isBlank()) {
				return error(MISSING_NAME, entity.entityType().externalName() + " must have a name");
			}
			Optional<Entity> existing = entities.find(entity.id());
			if (existing.isEmpty() || existing.get().entityType() != entity.entityType()) {
				return error(ENTITY_NOT_FOUND, "No " + entity.entityType().externalName() + " with id \"" + entity.id() + "\"");
			} else if (!existing.get().xmlId().equals(entity.xmlId())) {
				return error(XML_ID_CHANGED, "Can't change xml:id of \"" + entity.id() + "\" from \""
					+ existing.get().xmlId() + "\" to \"" + entity.xmlId() + "\"");
			} else {
				return Optional.empty();
			}
		}

		@Override
		public Optional<ValidationError> visitDelete(Entity entity, DeleteEntity delta) {
			Optional<Entity> existing = entities.find(entity.id());
			if (existing.isEmpty()) {
				return error(ENTITY_NOT_FOUND, "No " + entity.entityType().externalName() + " with id \"" + entity.id() + "\"");
			}
			Optional<Relationship> blocker = entities.relationshipsOf(entity.id())
				.filter(r -> entities.find(r.counterpartOf(entity.id()))
					.map(counterpart -> !counterpart.archived())
					.orElse(false))
				.findFirst();
			if (blocker.isPresent()) {
				Relationship r = blocker.get();
				return error(ENTITY_REFERENCED, "\"" + entity.id() + "\" is referenced by relationship \""
						+ r.id() + "\" (" + r.type() + ") with \"" + r.counterpartOf(entity.id()) + "\"",
					new Fix.ArchiveEntity(entity.id()));
			}
			return Optional.empty();
		}

		@Override
		public Optional<ValidationError> visitRelate(Relationship relationship, Relate delta) {
			for (Identifier endpoint: new Identifier[]{relationship.from(), relationship.to()}) {
				if (!entities.contains(endpoint)) {
					return error(ENTITY_NOT_FOUND, "Relationship endpoint \"" + endpoint + "\" does not exist");
				}
			}
			if (entities.relationships().containsID(relationship.id())
				|| (relationship.mutual() && entities.relationships().containsID(relationship.reciprocal().id()))) {
				return error(DUPLICATE_ID, "A relationship with id \"" + relationship.id() + "\" already exists");
			}
			Optional<Relationship> duplicate = entities.relationships().stream()
				.filter(r -> r.sameLinkAs(relationship)
					|| (relationship.mutual() && r.sameLinkAs(relationship.reciprocal())))
				.findFirst();
			if (duplicate.isPresent()) {
				return error(DUPLICATE_RELATIONSHIP, "\"" + relationship.from() + "\" is already related to \""
					+ relationship.to() + "\" as " + relationship.type() + " by \"" + duplicate.get().id() + "\"");
			}
			return Optional.empty();
		}

		@Override
		public Optional<ValidationError> visitUnrelate(Relationship relationship, Unrelate delta) {
			if (!entities.relationships().containsID(relationship.id())) {
				return error(ENTITY_NOT_FOUND, "No relationship with id \"" + relationship.id() + "\"");
			}
			return Optional.empty();
		}

		private String freeXmlId(String taken) {
			for (int i = 2; ; i++) {
				String candidate = taken + "-" + i;
				if (entities.findByXmlId(candidate).isEmpty()) {
					return candidate;
				}
			}
		}

		private static Optional<ValidationError> error(ErrorCode code, String message, Fix... fixes) {
			return Optional.of(ValidationError.of(code, message, fixes));
		}
	}

	@RequiredArgsConstructor
	private static final class DeltaApplier implements DeltaVisitor<EntityCollection> {
		final EntityCollection entities;

		@Override
		public EntityCollection visitCreate(Entity entity, CreateEntity delta) {
			return entities.with(entity);
		}

		@Override
		public EntityCollection visitUpdate(Entity entity, UpdateEntity delta) {
			return entities.with(entity);
		}

		@Override
		public EntityCollection visitDelete(Entity entity, DeleteEntity delta) {
			// Only relationships with archived counterparts can remain at this point
			EntityCollection result = entities.without(entity);
			for (Relationship r: entities.relationshipsOf(entity.id()).toList()) {
				result = result.withoutRelationship(r.id());
			}
			return result;
		}

		@Override
		public EntityCollection visitRelate(Relationship relationship, Relate delta) {
			EntityCollection result = entities.withRelationship(relationship);
			if (relationship.mutual()) {
				result = result.withRelationship(relationship.reciprocal());
			}
			return result;
		}

		@Override
		public EntityCollection visitUnrelate(Relationship relationship, Unrelate delta) {
			Relationship stored = entities.relationships().get(relationship.id());
			if (stored.mutual()) {
				return entities
					.withoutRelationship(stored.primaryId())
					.withoutRelationship(stored.reciprocalId());
			} else {
				return entities.withoutRelationship(stored.id());
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EntityOperations.class);
}
