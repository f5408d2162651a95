package works.quill.history;

import java.util.List;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityDelta;

import static java.util.Objects.requireNonNull;

/**
 * An immutable, linear history of entity changes.
 * <p>
 * The state at any point is <code>base</code> with the first <code>position</code> deltas applied in order.
 * Deltas after <code>position</code> have been undone and can be redone until a new delta is appended.
 */
public record DeltaLog(
	EntityCollection base,
	PVector<EntityDelta> deltas,
	int position
) {
	public DeltaLog {
		requireNonNull(base);
		requireNonNull(deltas);
		if (position < 0 || position > deltas.size()) {
			throw new IllegalArgumentException("Position " + position + " is outside [0, " + deltas.size() + "]");
		}
	}

	public static DeltaLog startingFrom(EntityCollection base) {
		return new DeltaLog(base, TreePVector.empty(), 0);
	}

	public static DeltaLog of(EntityCollection base, List<EntityDelta> deltas, int position) {
		return new DeltaLog(base, TreePVector.from(deltas), position);
	}

	public int size() {
		return deltas.size();
	}

	public boolean canUndo() {
		return position > 0;
	}

	public boolean canRedo() {
		return position < deltas.size();
	}

	/**
	 * The deltas that contribute to the current state.
	 */
	public List<EntityDelta> applied() {
		return deltas.subList(0, position);
	}

	public DeltaLog withPosition(int newPosition) {
		return new DeltaLog(base, deltas, newPosition);
	}

	/**
	 * Discards any undone deltas, then appends <code>delta</code> and moves past it.
	 */
	DeltaLog appended(EntityDelta delta) {
		PVector<EntityDelta> kept = deltas.subList(0, position);
		return new DeltaLog(base, kept.plus(delta), position + 1);
	}

	/**
	 * Moves the oldest delta into the base.
	 */
	DeltaLog withOldestFolded(EntityCollection newBase) {
		return new DeltaLog(newBase, deltas.minus(0), position - 1);
	}
}
