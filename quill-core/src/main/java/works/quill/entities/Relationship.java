package works.quill.entities;

import java.util.Optional;
import java.util.UUID;
import works.quill.Identified;
import works.quill.Identifier;

import static java.util.Objects.requireNonNull;

/**
 * A typed link from one entity to another.
 * <p>
 * A mutual relationship is stored as two records, one in each direction;
 * the second has the first's id with {@value #RECIPROCAL_SUFFIX} appended.
 * The pair is added and removed together.
 */
public record Relationship(
	Identifier id,
	Identifier from,
	Identifier to,
	String type,
	Optional<String> subtype,
	boolean mutual
) implements Identified {
	public static final String RECIPROCAL_SUFFIX = "-reciprocal";

	public Relationship {
		requireNonNull(id);
		requireNonNull(from);
		requireNonNull(to);
		requireNonNull(type);
		requireNonNull(subtype);
	}

	/**
	 * A new relationship with a fresh random id.
	 */
	public static Relationship between(Identifier from, Identifier to, String type, boolean mutual) {
		return new Relationship(Identifier.prefixed("rel", UUID.randomUUID().toString()), from, to, type, Optional.empty(), mutual);
	}

	public Relationship withSubtype(String newSubtype) {
		return new Relationship(id, from, to, type, Optional.ofNullable(newSubtype), mutual);
	}

	/**
	 * Whether this is the second record of a mutual pair.
	 * A directed relationship is never reciprocal, whatever its id.
	 */
	public boolean isReciprocal() {
		return mutual && id.toString().endsWith(RECIPROCAL_SUFFIX);
	}

	/**
	 * @return the id of the record that was added first; for a non-reciprocal record, its own id
	 */
	public Identifier primaryId() {
		if (isReciprocal()) {
			String s = id.toString();
			return Identifier.from(s.substring(0, s.length() - RECIPROCAL_SUFFIX.length()));
		} else {
			return id;
		}
	}

	public Identifier reciprocalId() {
		return Identifier.from(primaryId() + RECIPROCAL_SUFFIX);
	}

	/**
	 * @return the record for the opposite direction of this mutual relationship
	 */
	public Relationship reciprocal() {
		Identifier otherId = isReciprocal() ? primaryId() : reciprocalId();
		return new Relationship(otherId, to, from, type, subtype, mutual);
	}

	public boolean involves(Identifier entityId) {
		return from.equals(entityId) || to.equals(entityId);
	}

	public Identifier counterpartOf(Identifier entityId) {
		return from.equals(entityId) ? to : from;
	}

	/**
	 * Ignores ids: true if both records express the same link.
	 */
	public boolean sameLinkAs(Relationship other) {
		return from.equals(other.from)
			&& to.equals(other.to)
			&& type.equals(other.type)
			&& subtype.equals(other.subtype);
	}
}
