package org.flowblocks.workers.session;

/**
 * The provider rejected the completion of a received message. The message
 * will be redelivered once its lock expires.
 *
 */
public class AcknowledgmentException extends QueueSessionException {

	private static final long serialVersionUID = 1L;

	public AcknowledgmentException(String message, Throwable cause) {
		super(message, cause);
	}

	public AcknowledgmentException(String message) {
		super(message);
	}

}
