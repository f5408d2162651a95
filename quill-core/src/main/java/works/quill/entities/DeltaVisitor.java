package works.quill.entities;

/**
 * Switch patterns are still a preview feature in Java 17,
 * so code that wants to deal with {@link EntityDelta} objects polymorphically
 * can use this instead.
 */
public interface DeltaVisitor<R> {
	R visitCreate(Entity entity, CreateEntity delta);
	R visitUpdate(Entity entity, UpdateEntity delta);
	R visitDelete(Entity entity, DeleteEntity delta);
	R visitRelate(Relationship relationship, Relate delta);
	R visitUnrelate(Relationship relationship, Unrelate delta);

	default R visit(EntityDelta delta) {
		if (delta instanceof CreateEntity d) {
			return visitCreate(d.entity(), d);
		} else if (delta instanceof UpdateEntity d) {
			return visitUpdate(d.entity(), d);
		} else if (delta instanceof DeleteEntity d) {
			return visitDelete(d.entity(), d);
		} else if (delta instanceof Relate d) {
			return visitRelate(d.relationship(), d);
		} else if (delta instanceof Unrelate d) {
			return visitUnrelate(d.relationship(), d);
		} else {
			throw new AssertionError("Unexpected delta type: " + delta.getClass().getSimpleName());
		}
	}
}
