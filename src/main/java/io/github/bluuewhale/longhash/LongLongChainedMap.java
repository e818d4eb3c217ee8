package io.github.bluuewhale.longhash;

import java.util.OptionalLong;

/**
 * Separate-chaining map from {@code long} keys to {@code long} values stored inline.
 * Buckets default to {@link LongHashStrategy#SIGN_FOLDING}. Not thread-safe.
 */
public class LongLongChainedMap extends AbstractChainedMap {

	private long[] vals;

	public LongLongChainedMap() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public LongLongChainedMap(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public LongLongChainedMap(int initialCapacity, double loadFactor) {
		this(initialCapacity, loadFactor, LongHashStrategy.SIGN_FOLDING);
	}

	public LongLongChainedMap(int initialCapacity, double loadFactor, LongHashStrategy strategy) {
		super(initialCapacity, loadFactor, strategy);
		this.vals = Utils.allocate(poolLength(), long[]::new);
	}

	/**
	 * Inserts {@code key}, or overwrites its value when already present.
	 *
	 * @return true if a new key was added, false if an existing value was replaced
	 * @throws TableAllocationException if growth was needed and failed; the map is unchanged
	 */
	public boolean upsert(long key, long value) {
		int n = findNode(key);
		if (n != NIL) {
			vals[n] = value;
			return false;
		}
		n = linkNode(key);
		vals[n] = value;
		return true;
	}

	public OptionalLong get(long key) {
		int n = findNode(key);
		return (n != NIL) ? OptionalLong.of(vals[n]) : OptionalLong.empty();
	}

	public long getOrDefault(long key, long defaultValue) {
		int n = findNode(key);
		return (n != NIL) ? vals[n] : defaultValue;
	}

	public boolean remove(long key) {
		return unlinkNode(key) != NIL;
	}

	@Override
	protected void growValues(int newLength, int used) {
		long[] grown = Utils.allocate(newLength, long[]::new);
		System.arraycopy(vals, 0, grown, 0, used);
		this.vals = grown;
	}

	@Override
	protected void clearValues(int used) {
		// inline primitives hold nothing
	}
}
