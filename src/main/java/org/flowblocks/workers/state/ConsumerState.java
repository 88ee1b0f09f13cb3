package org.flowblocks.workers.state;

import java.util.Objects;

/**
 * Snapshot of the two timestamps a subscription persists. Either may be null
 * when the corresponding event has not happened yet.
 *
 */
public class ConsumerState {

	private final String lastCheckTime;
	private final String lastMessageReceivedTime;

	public ConsumerState(String lastCheckTime, String lastMessageReceivedTime) {
		this.lastCheckTime = lastCheckTime;
		this.lastMessageReceivedTime = lastMessageReceivedTime;
	}

	/**
	 * ISO-8601 time of the last poll attempt, successful or not.
	 * 
	 * @return
	 */
	public String getLastCheckTime() {
		return lastCheckTime;
	}

	/**
	 * ISO-8601 time of the last poll that received at least one message.
	 * 
	 * @return
	 */
	public String getLastMessageReceivedTime() {
		return lastMessageReceivedTime;
	}

	@Override
	public int hashCode() {
		return Objects.hash(lastCheckTime, lastMessageReceivedTime);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof ConsumerState)) {
			return false;
		}
		ConsumerState other = (ConsumerState) obj;
		return Objects.equals(lastCheckTime, other.lastCheckTime)
				&& Objects.equals(lastMessageReceivedTime, other.lastMessageReceivedTime);
	}

	@Override
	public String toString() {
		return "ConsumerState [lastCheckTime=" + lastCheckTime + ", lastMessageReceivedTime="
				+ lastMessageReceivedTime + "]";
	}
}
