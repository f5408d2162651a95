package works.quill.entities;

import java.time.Instant;

/**
 * Requests that <code>entity</code> be added to the collection.
 */
public record CreateEntity(
	Entity entity,
	Instant timestamp
) implements EntityDelta {
	@Override
	public EntityType entityType() {
		return entity.entityType();
	}

	@Override
	public String op() {
		return "create";
	}
}
