package io.github.bluuewhale.longhash;

/**
 * Resizing linear-probing set of {@code long} keys with tombstone deletion.
 * <p>
 * Before every {@link #add(long)} the table doubles if one more key would push
 * {@code size / capacity} past the load factor. When the live keys fit but live keys plus tombstones
 * would not, the table is rebuilt: at the same capacity if tombstones outnumber half the live keys,
 * doubled otherwise. Either way a rebuild frees a constant fraction of the slots, so the next one is
 * O(capacity) adds away, and at least one {@code EMPTY} slot always remains. Not thread-safe.
 */
public class LongProbingSet extends AbstractProbingSet {

	/* Defaults */
	private static final int DEFAULT_INITIAL_CAPACITY = 16;
	private static final double DEFAULT_LOAD_FACTOR = 0.75d;

	private final double loadFactor;

	public LongProbingSet() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public LongProbingSet(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public LongProbingSet(int initialCapacity, double loadFactor) {
		this(initialCapacity, loadFactor, LongHashStrategy.MIXING);
	}

	public LongProbingSet(int initialCapacity, double loadFactor, LongHashStrategy strategy) {
		super(initialCapacity, strategy);
		Utils.validateLoadFactor(loadFactor);
		this.loadFactor = loadFactor;
	}

	/**
	 * @throws TableAllocationException if a needed resize could not be allocated; the set is unchanged
	 */
	@Override
	public boolean add(long key) {
		maybeRehash();
		return insert(key);
	}

	public double loadFactor() {
		return loadFactor;
	}

	/* Resize/rehash */
	private void maybeRehash() {
		boolean overLoad = Utils.exceedsLoad(size, capacity, loadFactor);
		boolean overUsed = Utils.exceedsLoad(size + tombstones, capacity, loadFactor);
		if (!overLoad && !overUsed) return;

		int newCap = capacity;
		if (overLoad) {
			while (Utils.exceedsLoad(size, newCap, loadFactor)) {
				newCap = Utils.doubledCapacity(newCap);
			}
		} else if (tombstones <= (size >>> 1)) {
			// few tombstones: purging would free too little, grow instead
			newCap = Utils.doubledCapacity(capacity);
		}
		rebuild(newCap);
	}
}
