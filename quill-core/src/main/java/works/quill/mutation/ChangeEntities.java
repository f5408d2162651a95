package works.quill.mutation;

import works.quill.entities.EntityDelta;

public record ChangeEntities(EntityDelta delta) implements Mutation { }
