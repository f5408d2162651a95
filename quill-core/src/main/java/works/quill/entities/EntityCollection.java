package works.quill.entities;

import java.util.Optional;
import java.util.stream.Stream;
import works.quill.Catalog;
import works.quill.Identifier;

import static java.util.Objects.requireNonNull;

/**
 * All the entities and relationships of one document.
 * Each catalog keeps its entries in insertion order.
 */
public record EntityCollection(
	Catalog<Character> characters,
	Catalog<Place> places,
	Catalog<Organization> organizations,
	Catalog<Relationship> relationships
) {
	public EntityCollection {
		requireNonNull(characters);
		requireNonNull(places);
		requireNonNull(organizations);
		requireNonNull(relationships);
	}

	public static EntityCollection empty() {
		return new EntityCollection(Catalog.empty(), Catalog.empty(), Catalog.empty(), Catalog.empty());
	}

	/**
	 * Characters, then places, then organizations.
	 */
	public Stream<Entity> entities() {
		return Stream.of(characters.stream(), places.stream(), organizations.stream())
			.flatMap(s -> s.map(Entity.class::cast));
	}

	public Optional<Entity> find(Identifier id) {
		return entities().filter(e -> e.id().equals(id)).findFirst();
	}

	public Optional<Entity> findByXmlId(String xmlId) {
		return entities().filter(e -> e.xmlId().equals(xmlId)).findFirst();
	}

	/**
	 * Resolves an IDREF token as written in markup. A leading <code>#</code> is ignored,
	 * and the remainder may be either an xmlId or an engine id.
	 */
	public Optional<Entity> resolve(String reference) {
		String key = reference.startsWith("#") ? reference.substring(1) : reference;
		if (key.isEmpty()) {
			return Optional.empty();
		}
		return entities()
			.filter(e -> e.xmlId().equals(key) || e.id().toString().equals(key))
			.findFirst();
	}

	public boolean contains(Identifier id) {
		return find(id).isPresent();
	}

	/**
	 * Adds <code>entity</code>, or replaces the existing entity with the same id in place.
	 */
	public EntityCollection with(Entity entity) {
		if (entity instanceof Character c) {
			return new EntityCollection(characters.with(c), places, organizations, relationships);
		} else if (entity instanceof Place p) {
			return new EntityCollection(characters, places.with(p), organizations, relationships);
		} else if (entity instanceof Organization o) {
			return new EntityCollection(characters, places, organizations.with(o), relationships);
		} else {
			throw new AssertionError("Unexpected entity type: " + entity.getClass().getSimpleName());
		}
	}

	public EntityCollection without(Entity entity) {
		Identifier id = entity.id();
		if (entity instanceof Character) {
			return new EntityCollection(characters.without(id), places, organizations, relationships);
		} else if (entity instanceof Place) {
			return new EntityCollection(characters, places.without(id), organizations, relationships);
		} else if (entity instanceof Organization) {
			return new EntityCollection(characters, places, organizations.without(id), relationships);
		} else {
			throw new AssertionError("Unexpected entity type: " + entity.getClass().getSimpleName());
		}
	}

	public EntityCollection withRelationship(Relationship relationship) {
		return new EntityCollection(characters, places, organizations, relationships.with(relationship));
	}

	public EntityCollection withoutRelationship(Identifier relationshipId) {
		return new EntityCollection(characters, places, organizations, relationships.without(relationshipId));
	}

	/**
	 * @return relationships with <code>entityId</code> at either end
	 */
	public Stream<Relationship> relationshipsOf(Identifier entityId) {
		return relationships.stream().filter(r -> r.involves(entityId));
	}
}
