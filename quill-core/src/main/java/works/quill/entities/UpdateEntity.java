package works.quill.entities;

import java.time.Instant;

/**
 * Requests that the entity with the same id as <code>entity</code> be replaced by it.
 */
public record UpdateEntity(
	Entity entity,
	Instant timestamp
) implements EntityDelta {
	@Override
	public EntityType entityType() {
		return entity.entityType();
	}

	@Override
	public String op() {
		return "update";
	}
}
