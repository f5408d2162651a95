package works.quill.entities;

import java.util.Optional;
import works.quill.Identifier;

import static java.util.Objects.requireNonNull;

public record Organization(
	Identifier id,
	String xmlId,
	String name,
	Optional<String> orgType,
	boolean archived
) implements Entity {
	public Organization {
		requireNonNull(id);
		requireNonNull(xmlId);
		requireNonNull(name);
	}

	public static Organization named(String name) {
		return withXmlId(Slugs.slug(name), name);
	}

	public static Organization withXmlId(String xmlId, String name) {
		return new Organization(Slugs.entityId(EntityType.ORGANIZATION, xmlId), xmlId, name, Optional.empty(), false);
	}

	@Override
	public EntityType entityType() {
		return EntityType.ORGANIZATION;
	}

	@Override
	public Organization withArchived(boolean newArchived) {
		return new Organization(id, xmlId, name, orgType, newArchived);
	}

	public Organization withName(String newName) {
		return new Organization(id, xmlId, newName, orgType, archived);
	}

	public Organization withOrgType(String newOrgType) {
		return new Organization(id, xmlId, name, Optional.ofNullable(newOrgType), archived);
	}
}
