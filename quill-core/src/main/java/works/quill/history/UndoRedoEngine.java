package works.quill.history;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityDelta;
import works.quill.entities.EntityOperations;
import works.quill.exceptions.CorruptDeltaLogException;
import works.quill.exceptions.ValidationException;

/**
 * Undo and redo by replay: the state at any position is recomputed from the log's base,
 * so it can never drift from what the log says.
 * <p>
 * Logs are kept to at most <code>maxHistory</code> deltas; beyond that,
 * the oldest delta is folded into the base and can no longer be undone.
 */
public final class UndoRedoEngine {
	@Getter private final int maxHistory;

	public UndoRedoEngine(int maxHistory) {
		if (maxHistory < 1) {
			throw new IllegalArgumentException("maxHistory must be positive: " + maxHistory);
		}
		this.maxHistory = maxHistory;
	}

	/**
	 * @throws CorruptDeltaLogException if some delta can't be applied to the state before it
	 */
	public EntityCollection replay(DeltaLog log) {
		EntityCollection state = log.base();
		int index = 0;
		for (EntityDelta delta: log.applied()) {
			state = replayOne(state, delta, index++);
		}
		return state;
	}

	/**
	 * Validates <code>delta</code> against the current state, then appends it.
	 * Anything that had been undone is discarded.
	 */
	public HistoryStep apply(DeltaLog log, EntityDelta delta) throws ValidationException {
		EntityCollection current = replay(log);
		EntityCollection next = EntityOperations.applyEntityDelta(current, delta);
		if (log.canRedo()) {
			LOGGER.debug("Discarding {} undone deltas", log.size() - log.position());
		}
		DeltaLog newLog = log.appended(delta);
		while (newLog.size() > maxHistory) {
			EntityDelta oldest = newLog.deltas().get(0);
			newLog = newLog.withOldestFolded(replayOne(newLog.base(), oldest, 0));
			LOGGER.trace("Folded oldest {} into base", oldest.op());
		}
		return new HistoryStep(next, newLog, true);
	}

	public HistoryStep undo(DeltaLog log) {
		if (!log.canUndo()) {
			LOGGER.debug("Nothing to undo");
			return new HistoryStep(replay(log), log, false);
		}
		DeltaLog newLog = log.withPosition(log.position() - 1);
		return new HistoryStep(replay(newLog), newLog, true);
	}

	public HistoryStep redo(DeltaLog log) {
		if (!log.canRedo()) {
			LOGGER.debug("Nothing to redo");
			return new HistoryStep(replay(log), log, false);
		}
		DeltaLog newLog = log.withPosition(log.position() + 1);
		return new HistoryStep(replay(newLog), newLog, true);
	}

	private static EntityCollection replayOne(EntityCollection state, EntityDelta delta, int index) {
		try {
			return EntityOperations.applyEntityDelta(state, delta);
		} catch (ValidationException e) {
			throw new CorruptDeltaLogException("Delta #" + index + " (" + delta.op() + " " + delta.entityType() + ") can't be replayed", e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(UndoRedoEngine.class);
}
