package works.quill.entities;

import java.time.Instant;

/**
 * One recorded change to an {@link EntityCollection}.
 * A sequence of these, applied in order to a base collection, reproduces any later state.
 */
public sealed interface EntityDelta permits CreateEntity, UpdateEntity, DeleteEntity, Relate, Unrelate {
	Instant timestamp();

	EntityType entityType();

	/**
	 * The short name used to tag this kind of delta in persisted form.
	 */
	String op();

	default <R> R accept(DeltaVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
