package io.github.bluuewhale.longhash;

import java.util.function.IntFunction;

/**
 * Shared sizing and allocation helpers for the chained and probing tables.
 */
final class Utils {
	private Utils() {}

	/* Largest array length the VM reliably hands out */
	static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

	static void validateLoadFactor(double lf) {
		if (!(lf > 0.0d && lf < 1.0d)) {
			throw new InvalidConfigurationException("loadFactor must be in (0,1): " + lf);
		}
	}

	static void validateCapacity(int capacity) {
		if (capacity < 1 || capacity > MAX_CAPACITY) {
			throw new InvalidConfigurationException("capacity must be in [1," + MAX_CAPACITY + "]: " + capacity);
		}
	}

	/**
	 * Growth trigger: true when adding one more entry would push the load past {@code loadFactor}.
	 */
	static boolean exceedsLoad(int entries, int capacity, double loadFactor) {
		return (double) (entries + 1) / capacity > loadFactor;
	}

	static int doubledCapacity(int capacity) {
		if (capacity > MAX_CAPACITY / 2) {
			throw new TableAllocationException("cannot grow table beyond capacity " + capacity);
		}
		return capacity << 1;
	}

	/**
	 * Allocates a backing array, reporting heap exhaustion as {@link TableAllocationException}
	 * so the caller's table stays usable.
	 */
	static <T> T allocate(int length, IntFunction<T> factory) {
		try {
			return factory.apply(length);
		} catch (OutOfMemoryError e) {
			throw new TableAllocationException("failed to allocate backing array of length " + length, e);
		}
	}
}
