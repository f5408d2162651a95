package works.quill.mutation;

import works.quill.entities.EntityCollection;

/**
 * Replace the whole entity collection with one reconstructed from history.
 * Not validated: the restored state was valid when it was first reached,
 * though tags added since then may now point at entities it lacks.
 *
 * @param reason <code>undo</code> or <code>redo</code>
 */
public record RestoreEntities(
	EntityCollection entities,
	String reason
) implements Mutation { }
