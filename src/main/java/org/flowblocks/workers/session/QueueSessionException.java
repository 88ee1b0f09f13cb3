package org.flowblocks.workers.session;

/**
 * Base type for failures raised by a queue provider.
 *
 */
public class QueueSessionException extends Exception {

	private static final long serialVersionUID = 1L;

	public QueueSessionException(String message, Throwable cause) {
		super(message, cause);
	}

	public QueueSessionException(String message) {
		super(message);
	}

}
