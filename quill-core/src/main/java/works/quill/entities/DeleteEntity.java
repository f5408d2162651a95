package works.quill.entities;

import java.time.Instant;

/**
 * Requests that <code>entity</code> be removed outright.
 * Carries the whole entity rather than just its id so that the log
 * alone describes what was lost.
 */
public record DeleteEntity(
	Entity entity,
	Instant timestamp
) implements EntityDelta {
	@Override
	public EntityType entityType() {
		return entity.entityType();
	}

	@Override
	public String op() {
		return "delete";
	}
}
