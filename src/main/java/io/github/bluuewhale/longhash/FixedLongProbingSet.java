package io.github.bluuewhale.longhash;

/**
 * Linear-probing set of {@code long} keys that never grows.
 * <p>
 * Removal leaves tombstones, and nothing clears them implicitly. A tombstone is reused only by a
 * probe that ends on an {@code EMPTY} slot, so under sustained add/remove churn the {@code EMPTY}
 * slots run out and {@link #add(long)} of a new key throws {@link CapacityExhaustedException}, even
 * while {@link #size()} is far below {@link #capacity()}. Callers that churn can watch
 * {@link #tombstones()} and call {@link #compact()}.
 * <p>
 * This holds for a key that was just removed as well: in a saturated table
 * {@code add(k); remove(k); add(k)} throws on the second add, because the freed slot is a tombstone
 * and no probe can end on an {@code EMPTY} slot. Only {@link LongProbingSet} guarantees that a
 * tombstone is always reusable. Not thread-safe.
 */
public class FixedLongProbingSet extends AbstractProbingSet {

	public FixedLongProbingSet(int capacity) {
		this(capacity, LongHashStrategy.MIXING);
	}

	public FixedLongProbingSet(int capacity, LongHashStrategy strategy) {
		super(capacity, strategy);
	}

	/**
	 * @throws CapacityExhaustedException if the key is absent and the table holds no {@code EMPTY}
	 *         slot, even when tombstones remain
	 */
	@Override
	public boolean add(long key) {
		return insert(key);
	}

	/**
	 * Rebuilds the table at its current capacity, turning every tombstone back into an
	 * {@code EMPTY} slot.
	 *
	 * @throws TableAllocationException if the replacement array could not be allocated; the set is unchanged
	 */
	public void compact() {
		if (tombstones == 0) return;
		rebuild(capacity);
	}
}
