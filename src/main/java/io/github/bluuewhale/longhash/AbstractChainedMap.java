package io.github.bluuewhale.longhash;

import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Separate-chaining boilerplate shared by the {@code long}-keyed maps.
 * <p>
 * Entries live in an index-addressed node pool ({@code keys[]}, {@code next[]} and the subclass's
 * value array). A chain is a sequence of node indexes threaded through {@code next[]} and
 * terminated by {@link #NIL}; released nodes are pushed onto a free list threaded through the
 * same array and are reused before the pool grows.
 */
abstract class AbstractChainedMap {

	protected static final int NIL = -1;

	/* Defaults */
	protected static final int DEFAULT_INITIAL_CAPACITY = 16;
	protected static final double DEFAULT_LOAD_FACTOR = 0.75d;
	private static final int MIN_POOL_SIZE = 4;

	protected final double loadFactor;
	protected final LongHashStrategy strategy;

	/* Buckets */
	protected int capacity;
	protected int size;
	private int[] heads;

	/* Node pool */
	private long[] keys;
	private int[] next;
	private int freeHead = NIL; // most recently released node
	private int poolTop;        // first node never handed out

	protected AbstractChainedMap(int initialCapacity, double loadFactor, LongHashStrategy strategy) {
		Utils.validateCapacity(initialCapacity);
		Utils.validateLoadFactor(loadFactor);
		this.loadFactor = loadFactor;
		this.strategy = Objects.requireNonNull(strategy, "strategy");

		int poolSize = Math.max(MIN_POOL_SIZE, (int) (initialCapacity * loadFactor));
		this.heads = Utils.allocate(initialCapacity, int[]::new);
		Arrays.fill(this.heads, NIL);
		this.keys = Utils.allocate(poolSize, long[]::new);
		this.next = Utils.allocate(poolSize, int[]::new);
		this.capacity = initialCapacity;
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	/**
	 * Number of buckets. Only ever grows.
	 */
	public int capacity() {
		return capacity;
	}

	public boolean containsKey(long key) {
		return findNode(key) != NIL;
	}

	/**
	 * Drops every entry. The bucket count and the node pool keep their current size.
	 */
	public void clear() {
		Arrays.fill(heads, NIL);
		clearValues(poolTop);
		freeHead = NIL;
		poolTop = 0;
		size = 0;
	}

	/* Hooks for subclasses */

	/** Allocates a value array of {@code newLength}, copies the first {@code used} values and swaps it in. */
	protected abstract void growValues(int newLength, int used);

	/** Releases whatever the first {@code used} value slots still reference. */
	protected abstract void clearValues(int used);

	/* Chain operations */

	protected final int findNode(long key) {
		for (int n = heads[bucket(key)]; n != NIL; n = next[n]) {
			if (keys[n] == key) return n;
		}
		return NIL;
	}

	/**
	 * Links a fresh node for {@code key}, which the caller has checked is absent, at the head of
	 * its chain. Bucket growth and pool growth are both allocated before either is committed, so a
	 * {@link TableAllocationException} leaves the map as it was.
	 */
	protected final int linkNode(long key) {
		int @Nullable [] grownHeads = null;
		if (Utils.exceedsLoad(size, capacity, loadFactor)) {
			grownHeads = Utils.allocate(Utils.doubledCapacity(capacity), int[]::new);
		}
		if (freeHead == NIL && poolTop == keys.length) {
			growPool();
		}
		if (grownHeads != null) {
			rehash(grownHeads);
		}

		int n = takeNode();
		int b = bucket(key);
		keys[n] = key;
		next[n] = heads[b];
		heads[b] = n;
		size++;
		return n;
	}

	/**
	 * Detaches the node holding {@code key} and returns it to the free list. The node's value slot
	 * is left untouched so the caller can still read it.
	 *
	 * @return the released node, or {@link #NIL} when the key is absent
	 */
	protected final int unlinkNode(long key) {
		int b = bucket(key);
		int prev = NIL;
		int n = heads[b];
		while (n != NIL) {
			if (keys[n] == key) {
				if (prev == NIL) {
					heads[b] = next[n];
				} else {
					next[prev] = next[n];
				}
				next[n] = freeHead;
				freeHead = n;
				size--;
				return n;
			}
			prev = n;
			n = next[n];
		}
		return NIL;
	}

	int poolLength() {
		return keys.length;
	}

	/* Internal helpers */
	private int bucket(long key) {
		return strategy.indexFor(key, capacity);
	}

	private int takeNode() {
		if (freeHead != NIL) {
			int n = freeHead;
			freeHead = next[n];
			return n;
		}
		return poolTop++;
	}

	private void growPool() {
		int newLength = Utils.doubledCapacity(keys.length);
		long[] newKeys = Utils.allocate(newLength, long[]::new);
		int[] newNext = Utils.allocate(newLength, int[]::new);
		growValues(newLength, poolTop); // last allocation, nothing below can fail

		System.arraycopy(keys, 0, newKeys, 0, poolTop);
		System.arraycopy(next, 0, newNext, 0, poolTop);
		this.keys = newKeys;
		this.next = newNext;
	}

	/**
	 * Relinks every node into {@code newHeads}. Nodes stay where they are in the pool; only
	 * {@code next[]} and the bucket array change.
	 */
	private void rehash(int[] newHeads) {
		int newCapacity = newHeads.length;
		Arrays.fill(newHeads, NIL);
		for (int b = 0; b < capacity; b++) {
			int n = heads[b];
			while (n != NIL) {
				int following = next[n];
				int nb = strategy.indexFor(keys[n], newCapacity);
				next[n] = newHeads[nb];
				newHeads[nb] = n;
				n = following;
			}
		}
		this.heads = newHeads;
		this.capacity = newCapacity;
	}
}
