package org.flowblocks.workers.state;

import java.util.Arrays;
import java.util.List;

import org.flowblocks.workers.message.Timestamps;

/**
 * Reads and writes the {@link ConsumerState} of one block through its
 * {@link ConsumerStateStore}.
 *
 */
public class ConsumerStateTracker {

	public static final String LAST_CHECK_TIME_KEY = "lastCheckTime";
	public static final String LAST_MESSAGE_RECEIVED_TIME_KEY = "lastMessageReceivedTime";

	static final List<String> ALL_KEYS = Arrays.asList(LAST_CHECK_TIME_KEY, LAST_MESSAGE_RECEIVED_TIME_KEY);

	private final ConsumerStateStore store;

	public ConsumerStateTracker(ConsumerStateStore store) {
		if (store == null) {
			throw new IllegalArgumentException("ConsumerStateStore cannot be null");
		}
		this.store = store;
	}

	public void recordCheck(long epochMillis) {
		store.set(LAST_CHECK_TIME_KEY, Timestamps.format(epochMillis));
	}

	public void recordMessageReceived(long epochMillis) {
		store.set(LAST_MESSAGE_RECEIVED_TIME_KEY, Timestamps.format(epochMillis));
	}

	public ConsumerState getState() {
		return new ConsumerState(store.get(LAST_CHECK_TIME_KEY), store.get(LAST_MESSAGE_RECEIVED_TIME_KEY));
	}

	/**
	 * Remove both timestamps.
	 */
	public void clear() {
		store.deleteAll(ALL_KEYS);
	}
}
