package io.github.bluuewhale.longhash;

import java.util.Arrays;
import java.util.Objects;

/**
 * Linear-probing set of {@code long} over a flat slot array with tombstone deletion.
 * <p>
 * Every probe starts at the key's home slot and walks forward one slot at a time, wrapping at the
 * end, for at most {@code capacity} steps. {@link SlotState#EMPTY} ends a probe,
 * {@link SlotState#DELETED} never does.
 */
abstract class AbstractProbingSet {

	/* probeForAdd results */
	private static final int DUPLICATE = -1;
	private static final int NO_SLOT = -2;

	protected final LongHashStrategy strategy;

	/* Storage */
	private long[] keys;
	private SlotState[] states;
	protected int capacity;
	protected int size;
	protected int tombstones;
	private int rebuilds;

	protected AbstractProbingSet(int capacity, LongHashStrategy strategy) {
		Utils.validateCapacity(capacity);
		this.strategy = Objects.requireNonNull(strategy, "strategy");
		this.keys = Utils.allocate(capacity, long[]::new);
		this.states = newStates(capacity);
		this.capacity = capacity;
	}

	/* Public API */

	/**
	 * @return true if {@code key} was inserted, false if it was already present
	 */
	public abstract boolean add(long key);

	public boolean contains(long key) {
		return findIndex(key) >= 0;
	}

	/**
	 * Marks the slot holding {@code key} as a tombstone.
	 *
	 * @return true if the key was present
	 */
	public boolean remove(long key) {
		int idx = findIndex(key);
		if (idx < 0) return false;
		states[idx] = SlotState.DELETED;
		size--;
		tombstones++;
		return true;
	}

	/**
	 * Number of keys present. Tombstones are not counted.
	 */
	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	public int capacity() {
		return capacity;
	}

	/**
	 * Number of {@link SlotState#DELETED} slots awaiting a rebuild.
	 */
	public int tombstones() {
		return tombstones;
	}

	public void clear() {
		Arrays.fill(states, SlotState.EMPTY);
		size = 0;
		tombstones = 0;
	}

	/* Probing */

	/**
	 * Adds {@code key} unless present. The probe walks past tombstones, so a copy further along is
	 * still reported as a duplicate, until it reaches an {@code EMPTY} slot. The key then goes to the
	 * first tombstone seen on the way, or to that {@code EMPTY} slot.
	 * <p>
	 * A table with no {@code EMPTY} slot left is saturated: a full cycle that neither finds the key
	 * nor ends on an {@code EMPTY} slot fails, whatever mix of live keys and tombstones fills it.
	 *
	 * @throws CapacityExhaustedException if the table is saturated and the key is absent
	 */
	protected final boolean insert(long key) {
		int idx = probeForAdd(key);
		if (idx == DUPLICATE) return false;
		if (idx == NO_SLOT) throw new CapacityExhaustedException(capacity, size);
		if (states[idx] == SlotState.DELETED) tombstones--;
		states[idx] = SlotState.OCCUPIED;
		keys[idx] = key;
		size++;
		return true;
	}

	private int probeForAdd(long key) {
		int idx = strategy.indexFor(key, capacity);
		int firstTombstone = -1;
		for (int i = 0; i < capacity; i++) {
			SlotState s = states[idx];
			if (s == SlotState.EMPTY) {
				return (firstTombstone >= 0) ? firstTombstone : idx;
			}
			if (s == SlotState.DELETED) {
				if (firstTombstone < 0) firstTombstone = idx;
			} else if (keys[idx] == key) {
				return DUPLICATE;
			}
			if (++idx == capacity) idx = 0;
		}
		return NO_SLOT;
	}

	private int findIndex(long key) {
		if (size == 0) return -1;
		int idx = strategy.indexFor(key, capacity);
		for (int i = 0; i < capacity; i++) {
			SlotState s = states[idx];
			if (s == SlotState.EMPTY) return -1;
			if (s == SlotState.OCCUPIED && keys[idx] == key) return idx;
			if (++idx == capacity) idx = 0;
		}
		return -1;
	}

	/* Rebuild */

	/**
	 * Re-inserts every live key into a freshly allocated, all-{@code EMPTY} array of
	 * {@code newCapacity} slots, dropping all tombstones. The old arrays are replaced only once the
	 * new ones are fully populated.
	 */
	protected final void rebuild(int newCapacity) {
		long[] newKeys = newKeyArray(newCapacity);
		SlotState[] newStates = newStates(newCapacity);

		for (int i = 0; i < capacity; i++) {
			if (states[i] != SlotState.OCCUPIED) continue;
			long k = keys[i];
			int idx = strategy.indexFor(k, newCapacity);
			while (newStates[idx] != SlotState.EMPTY) {
				if (++idx == newCapacity) idx = 0;
			}
			newKeys[idx] = k;
			newStates[idx] = SlotState.OCCUPIED;
		}

		this.keys = newKeys;
		this.states = newStates;
		this.capacity = newCapacity;
		this.tombstones = 0;
		this.rebuilds++;
	}

	long[] newKeyArray(int length) {
		return Utils.allocate(length, long[]::new);
	}

	SlotState stateAt(int idx) {
		return states[idx];
	}

	/** Rebuilds since construction, growth and same-capacity purges alike. */
	int rebuildCount() {
		return rebuilds;
	}

	private static SlotState[] newStates(int length) {
		SlotState[] s = Utils.allocate(length, SlotState[]::new);
		Arrays.fill(s, SlotState.EMPTY);
		return s;
	}
}
