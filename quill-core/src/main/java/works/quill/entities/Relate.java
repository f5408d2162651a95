package works.quill.entities;

import java.time.Instant;

/**
 * Requests that <code>relationship</code> be added, along with its reciprocal if it's mutual.
 */
public record Relate(
	Relationship relationship,
	Instant timestamp
) implements EntityDelta {
	@Override
	public EntityType entityType() {
		return EntityType.RELATIONSHIP;
	}

	@Override
	public String op() {
		return "relate";
	}
}
