package works.quill.entities;

import java.util.Optional;
import works.quill.Identifier;

import static java.util.Objects.requireNonNull;

/**
 * A location in the text, corresponding to a <code>place</code> element.
 * Coordinates are kept as written in <code>location/geo</code>, typically <code>"lat lon"</code>.
 */
public record Place(
	Identifier id,
	String xmlId,
	String name,
	Optional<String> country,
	Optional<String> coordinates,
	boolean archived
) implements Entity {
	public Place {
		requireNonNull(id);
		requireNonNull(xmlId);
		requireNonNull(name);
	}

	public static Place named(String name) {
		return withXmlId(Slugs.slug(name), name);
	}

	public static Place withXmlId(String xmlId, String name) {
		return new Place(Slugs.entityId(EntityType.PLACE, xmlId), xmlId, name, Optional.empty(), Optional.empty(), false);
	}

	@Override
	public EntityType entityType() {
		return EntityType.PLACE;
	}

	@Override
	public Place withArchived(boolean newArchived) {
		return new Place(id, xmlId, name, country, coordinates, newArchived);
	}

	public Place withName(String newName) {
		return new Place(id, xmlId, newName, country, coordinates, archived);
	}

	public Place withCountry(String newCountry) {
		return new Place(id, xmlId, name, Optional.ofNullable(newCountry), coordinates, archived);
	}

	public Place withCoordinates(String newCoordinates) {
		return new Place(id, xmlId, name, country, Optional.ofNullable(newCoordinates), archived);
	}
}
