package org.flowblocks.workers.session;

/**
 * Transport or authentication failure while opening a session, receiving or
 * peeking.
 *
 */
public class ConnectivityException extends QueueSessionException {

	private static final long serialVersionUID = 1L;

	public ConnectivityException(String message, Throwable cause) {
		super(message, cause);
	}

	public ConnectivityException(String message) {
		super(message);
	}

}
