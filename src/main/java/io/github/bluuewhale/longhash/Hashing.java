package io.github.bluuewhale.longhash;

/**
 * Index functions for {@code long} keys.
 */
public final class Hashing {
	private Hashing() {}

	private static final long MIX_1 = 0xbf58476d1ce4e5b9L;
	private static final long MIX_2 = 0x94d049bb133111ebL;

	/**
	 * splitmix64 finalizer: every input bit affects every output bit.
	 */
	public static long mix64(long key) {
		long x = key;
		x = ((x >>> 30) ^ x) * MIX_1;
		x = ((x >>> 27) ^ x) * MIX_2;
		return (x >>> 31) ^ x;
	}

	/**
	 * {@code mix64(key)} read as unsigned, reduced modulo {@code capacity}.
	 */
	public static int mixedIndex(long key, int capacity) {
		return (int) Long.remainderUnsigned(mix64(key), capacity);
	}

	/**
	 * {@code |key| mod capacity}. Keys congruent modulo the capacity share an index
	 * (1, 17 and 33 at capacity 16), as do {@code k} and {@code -k}.
	 */
	public static int foldedIndex(long key, int capacity) {
		// remainder first so Long.MIN_VALUE never gets negated
		return (int) Math.abs(key % capacity);
	}
}
