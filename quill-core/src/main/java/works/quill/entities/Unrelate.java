package works.quill.entities;

import java.time.Instant;

/**
 * Requests that <code>relationship</code> be removed, along with its reciprocal if it's mutual.
 */
public record Unrelate(
	Relationship relationship,
	Instant timestamp
) implements EntityDelta {
	@Override
	public EntityType entityType() {
		return EntityType.RELATIONSHIP;
	}

	@Override
	public String op() {
		return "unrelate";
	}
}
