package works.quill.mutation;

/**
 * A requested change to a {@link works.quill.document.Document}.
 * Every mutation is validated in full before any part of it is applied.
 */
public sealed interface Mutation permits AddTag, RemoveTag, ChangeTagAttributes, ChangeEntities, RestoreEntities {
	default <R> R accept(MutationVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
