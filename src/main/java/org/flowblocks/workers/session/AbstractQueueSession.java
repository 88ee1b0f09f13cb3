package org.flowblocks.workers.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Makes {@link #close()} idempotent and guarantees that a failure while
 * releasing the provider connection is logged rather than thrown, so it can
 * never replace the outcome of the block that opened the session.
 *
 */
public abstract class AbstractQueueSession implements QueueSession {

	private static final Logger log = LogManager.getLogger(AbstractQueueSession.class);

	private final String queueName;
	private boolean closed = false;

	protected AbstractQueueSession(String queueName) {
		this.queueName = queueName;
	}

	public String getQueueName() {
		return queueName;
	}

	public boolean isClosed() {
		return closed;
	}

	@Override
	public final void close() {
		if (closed) {
			return;
		}
		closed = true;
		try {
			doClose();
		} catch (RuntimeException e) {
			log.warn("Failed to close session for queue: " + queueName + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Release the provider resources. Called at most once.
	 */
	protected abstract void doClose();

	/**
	 * Guard used by the provider operations.
	 */
	protected void assertOpen() {
		if (closed) {
			throw new IllegalStateException("Session for queue: " + queueName + " is already closed");
		}
	}
}
