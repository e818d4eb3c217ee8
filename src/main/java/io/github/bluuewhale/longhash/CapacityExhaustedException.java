package io.github.bluuewhale.longhash;

/**
 * Thrown by {@link FixedLongProbingSet#add(long)} when a full probe cycle finds no slot to write to.
 * This also happens at low {@code size} once tombstones have taken every free slot.
 */
public class CapacityExhaustedException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final int capacity;
	private final int size;

	public CapacityExhaustedException(int capacity, int size) {
		super("no free slot after full probe cycle (capacity=" + capacity + ", size=" + size + ")");
		this.capacity = capacity;
		this.size = size;
	}

	public int capacity() {
		return capacity;
	}

	public int size() {
		return size;
	}
}
