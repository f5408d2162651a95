package works.quill.history;

import works.quill.entities.EntityCollection;

/**
 * The result of moving through, or adding to, a {@link DeltaLog}.
 *
 * @param entities the state at the log's new position
 * @param changed false if the request was a no-op, such as undoing at the start of the log
 */
public record HistoryStep(
	EntityCollection entities,
	DeltaLog log,
	boolean changed
) { }
