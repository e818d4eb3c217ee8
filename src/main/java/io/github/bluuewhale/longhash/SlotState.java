package io.github.bluuewhale.longhash;

/**
 * Per-slot marker of an open-addressed table.
 * <p>
 * {@code EMPTY -> OCCUPIED} on insert, {@code OCCUPIED -> DELETED} on remove, and a later insert may
 * turn a {@code DELETED} slot back into {@code OCCUPIED}. {@code DELETED} only becomes {@code EMPTY}
 * when the whole table is rebuilt into a fresh array.
 */
public enum SlotState {
	/** Never used since the last rebuild. Terminates every probe. */
	EMPTY,
	/** Holds a live key. */
	OCCUPIED,
	/** Tombstone. Skipped by lookups, reusable by inserts. */
	DELETED
}
