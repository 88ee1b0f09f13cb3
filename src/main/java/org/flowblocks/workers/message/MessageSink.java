package org.flowblocks.workers.message;

/**
 * Receives emitted events one at a time, in receipt order. The caller does not
 * wait for any acknowledgment from the sink.
 *
 * @param <T> The type of event accepted.
 */
@FunctionalInterface
public interface MessageSink<T> {

	/**
	 * Emit a single event.
	 * 
	 * @param event
	 */
	void emit(T event);

}
