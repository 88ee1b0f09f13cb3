package org.flowblocks.workers;

/**
 * Thrown when a queue name, credential or numeric setting is missing or out of
 * range. Configuration problems are never retried automatically.
 *
 */
public class InvalidConfigurationException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidConfigurationException(String message) {
		super(message);
	}

}
