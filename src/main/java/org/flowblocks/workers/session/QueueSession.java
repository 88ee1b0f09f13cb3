package org.flowblocks.workers.session;

import java.time.Duration;
import java.util.List;

import org.flowblocks.workers.message.QueueMessage;

/**
 * A connection and receiver bound to a single queue for the duration of one
 * poll cycle or probe. Sessions must be opened with try-with-resources so that
 * {@link #close()} runs exactly once on every exit path.
 *
 */
public interface QueueSession extends AutoCloseable {

	/**
	 * Receive up to maxCount messages, waiting at most timeout for the first
	 * one. Received messages are locked until acknowledged or until the lock
	 * expires.
	 * 
	 * @param maxCount
	 * @param timeout
	 * @return The messages in receipt order. Empty when none arrived in time.
	 * @throws ConnectivityException
	 */
	List<QueueMessage> receive(int maxCount, Duration timeout) throws ConnectivityException;

	/**
	 * Complete a message received by this session, removing it from the queue.
	 * 
	 * @param message
	 * @throws AcknowledgmentException
	 */
	void acknowledge(QueueMessage message) throws AcknowledgmentException;

	/**
	 * Look at up to count messages without locking or consuming them.
	 * 
	 * @param count
	 * @return
	 * @throws ConnectivityException
	 */
	List<QueueMessage> peek(int count) throws ConnectivityException;

	/**
	 * Release the connection. Never throws.
	 */
	@Override
	void close();
}
