package io.github.bluuewhale.longhash;

/**
 * Backing storage for a table could not be obtained. The table that threw it is left in its
 * previous state and stays usable.
 */
public class TableAllocationException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public TableAllocationException(String message) {
		super(message);
	}

	public TableAllocationException(String message, Throwable cause) {
		super(message, cause);
	}
}
