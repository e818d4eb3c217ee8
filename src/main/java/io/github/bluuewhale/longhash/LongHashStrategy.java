package io.github.bluuewhale.longhash;

/**
 * Maps a key to its home bucket or slot. Implementations must be deterministic and return a
 * value in {@code [0, capacity)}; the result may change whenever the capacity does.
 */
@FunctionalInterface
public interface LongHashStrategy {

	/** Avalanche mixing, see {@link Hashing#mixedIndex(long, int)}. */
	LongHashStrategy MIXING = Hashing::mixedIndex;

	/** Plain sign-folded modulo, see {@link Hashing#foldedIndex(long, int)}. */
	LongHashStrategy SIGN_FOLDING = Hashing::foldedIndex;

	int indexFor(long key, int capacity);
}
