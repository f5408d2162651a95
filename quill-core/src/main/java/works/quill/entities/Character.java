package works.quill.entities;

import java.util.List;
import java.util.Optional;
import works.quill.Identifier;

import static java.util.Objects.requireNonNull;

/**
 * A person in the text, corresponding to a <code>person</code> element.
 */
public record Character(
	Identifier id,
	String xmlId,
	String name,
	Optional<String> sex,
	Optional<Integer> age,
	Optional<String> occupation,
	List<String> traits,
	Optional<String> socialStatus,
	Optional<String> maritalStatus,
	boolean archived
) implements Entity {
	public Character {
		requireNonNull(id);
		requireNonNull(xmlId);
		requireNonNull(name);
		traits = List.copyOf(traits);
	}

	public static Character named(String name) {
		return withXmlId(Slugs.slug(name), name);
	}

	public static Character withXmlId(String xmlId, String name) {
		return new Character(
			Slugs.entityId(EntityType.CHARACTER, xmlId), xmlId, name,
			Optional.empty(), Optional.empty(), Optional.empty(), List.of(),
			Optional.empty(), Optional.empty(), false);
	}

	@Override
	public EntityType entityType() {
		return EntityType.CHARACTER;
	}

	@Override
	public Character withArchived(boolean newArchived) {
		return new Character(id, xmlId, name, sex, age, occupation, traits, socialStatus, maritalStatus, newArchived);
	}

	public Character withName(String newName) {
		return new Character(id, xmlId, newName, sex, age, occupation, traits, socialStatus, maritalStatus, archived);
	}

	public Character withSex(String newSex) {
		return new Character(id, xmlId, name, Optional.ofNullable(newSex), age, occupation, traits, socialStatus, maritalStatus, archived);
	}

	public Character withAge(Integer newAge) {
		return new Character(id, xmlId, name, sex, Optional.ofNullable(newAge), occupation, traits, socialStatus, maritalStatus, archived);
	}

	public Character withOccupation(String newOccupation) {
		return new Character(id, xmlId, name, sex, age, Optional.ofNullable(newOccupation), traits, socialStatus, maritalStatus, archived);
	}

	public Character withTraits(List<String> newTraits) {
		return new Character(id, xmlId, name, sex, age, occupation, newTraits, socialStatus, maritalStatus, archived);
	}

	public Character withSocialStatus(String newSocialStatus) {
		return new Character(id, xmlId, name, sex, age, occupation, traits, Optional.ofNullable(newSocialStatus), maritalStatus, archived);
	}

	public Character withMaritalStatus(String newMaritalStatus) {
		return new Character(id, xmlId, name, sex, age, occupation, traits, socialStatus, Optional.ofNullable(newMaritalStatus), archived);
	}
}
