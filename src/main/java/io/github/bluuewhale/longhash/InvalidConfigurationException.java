package io.github.bluuewhale.longhash;

/**
 * Thrown when a table is constructed with a capacity or load factor it cannot work with.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidConfigurationException(String message) {
		super(message);
	}
}
