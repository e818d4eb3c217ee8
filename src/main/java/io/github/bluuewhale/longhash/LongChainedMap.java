package io.github.bluuewhale.longhash;

import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Separate-chaining map from {@code long} keys to caller-owned values.
 * <p>
 * The map holds a reference to each value and nothing more: it never copies, closes or otherwise
 * releases a value. Values that need explicit release (buffers, handles, {@link AutoCloseable}s)
 * remain the caller's responsibility before or after they are removed, and before or after the
 * map is cleared. {@link #remove(long)} hands the detached value back for that purpose.
 * <p>
 * Null values are not supported, so a {@code null} from {@link #get(long)} always means "absent".
 * Not thread-safe.
 */
public class LongChainedMap<V> extends AbstractChainedMap {

	private @Nullable Object[] vals;

	public LongChainedMap() {
		this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public LongChainedMap(int initialCapacity) {
		this(initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public LongChainedMap(int initialCapacity, double loadFactor) {
		this(initialCapacity, loadFactor, LongHashStrategy.SIGN_FOLDING);
	}

	public LongChainedMap(int initialCapacity, double loadFactor, LongHashStrategy strategy) {
		super(initialCapacity, loadFactor, strategy);
		this.vals = Utils.allocate(poolLength(), Object[]::new);
	}

	/**
	 * Inserts {@code key}, or points it at {@code value} when already present. A replaced value is
	 * simply dropped by the map.
	 *
	 * @return true if a new key was added, false if an existing value was replaced
	 * @throws TableAllocationException if growth was needed and failed; the map is unchanged
	 */
	public boolean upsert(long key, V value) {
		Objects.requireNonNull(value, "Null values not supported");
		int n = findNode(key);
		if (n != NIL) {
			vals[n] = value;
			return false;
		}
		n = linkNode(key);
		vals[n] = value;
		return true;
	}

	public @Nullable V get(long key) {
		int n = findNode(key);
		return (n != NIL) ? valueAt(n) : null;
	}

	/**
	 * @return the value that was mapped to {@code key}, or null if the key was absent
	 */
	public @Nullable V remove(long key) {
		int n = unlinkNode(key);
		if (n == NIL) return null;
		V old = valueAt(n);
		vals[n] = null;
		return old;
	}

	@Override
	protected void growValues(int newLength, int used) {
		Object[] grown = Utils.allocate(newLength, Object[]::new);
		System.arraycopy(vals, 0, grown, 0, used);
		this.vals = grown;
	}

	@Override
	protected void clearValues(int used) {
		Arrays.fill(vals, 0, used, null);
	}

	@SuppressWarnings("unchecked")
	private V valueAt(int n) {
		return (V) vals[n];
	}
}
