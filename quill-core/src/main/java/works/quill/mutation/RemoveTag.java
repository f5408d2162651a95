package works.quill.mutation;

import works.quill.Identifier;

/**
 * Unwrap a tag, keeping its text and any tags inside it.
 */
public record RemoveTag(
	Identifier passageId,
	Identifier tagId
) implements Mutation { }
