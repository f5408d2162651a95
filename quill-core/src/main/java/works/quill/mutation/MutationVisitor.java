package works.quill.mutation;

/**
 * Switch patterns are still a preview feature in Java 17,
 * so code that wants to deal with {@link Mutation} objects polymorphically
 * can use this instead.
 */
public interface MutationVisitor<R> {
	R visitAddTag(AddTag mutation);
	R visitRemoveTag(RemoveTag mutation);
	R visitChangeTagAttributes(ChangeTagAttributes mutation);
	R visitChangeEntities(ChangeEntities mutation);
	R visitRestoreEntities(RestoreEntities mutation);

	default R visit(Mutation mutation) {
		if (mutation instanceof AddTag m) {
			return visitAddTag(m);
		} else if (mutation instanceof RemoveTag m) {
			return visitRemoveTag(m);
		} else if (mutation instanceof ChangeTagAttributes m) {
			return visitChangeTagAttributes(m);
		} else if (mutation instanceof ChangeEntities m) {
			return visitChangeEntities(m);
		} else if (mutation instanceof RestoreEntities m) {
			return visitRestoreEntities(m);
		} else {
			throw new AssertionError("Unexpected mutation type: " + mutation.getClass().getSimpleName());
		}
	}
}
