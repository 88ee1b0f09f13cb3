package org.flowblocks.workers.poll;

import java.time.Duration;

import org.flowblocks.workers.InvalidConfigurationException;

/**
 * Configuration of a single poll cycle against one queue.
 *
 */
public class PollCycleConfiguration {

	public static final int DEFAULT_MAX_MESSAGES = 10;
	public static final double DEFAULT_RECEIVE_TIMEOUT_SECONDS = 5;

	String queueName;
	Integer maxMessages;
	Double receiveTimeoutSeconds;

	public PollCycleConfiguration() {
	}

	public PollCycleConfiguration(String queueName) {
		this.queueName = queueName;
	}

	/**
	 * The name of the queue to consume from.
	 * 
	 * @return
	 */
	public String getQueueName() {
		return queueName;
	}

	public void setQueueName(String queueName) {
		this.queueName = queueName;
	}

	/**
	 * Maximum number of messages to receive per poll cycle. Values above the
	 * provider's batch ceiling are clamped. Defaults to
	 * {@link #DEFAULT_MAX_MESSAGES}.
	 * 
	 * @return
	 */
	public int getMaxMessages() {
		return maxMessages == null ? DEFAULT_MAX_MESSAGES : maxMessages;
	}

	public void setMaxMessages(Integer maxMessages) {
		this.maxMessages = maxMessages;
	}

	/**
	 * How long to wait for messages before returning. Defaults to
	 * {@link #DEFAULT_RECEIVE_TIMEOUT_SECONDS}.
	 * 
	 * @return
	 */
	public double getReceiveTimeoutSeconds() {
		return receiveTimeoutSeconds == null ? DEFAULT_RECEIVE_TIMEOUT_SECONDS : receiveTimeoutSeconds;
	}

	public void setReceiveTimeoutSeconds(Double receiveTimeoutSeconds) {
		this.receiveTimeoutSeconds = receiveTimeoutSeconds;
	}

	public Duration getReceiveTimeout() {
		return Duration.ofMillis(Math.round(getReceiveTimeoutSeconds() * 1000));
	}

	/**
	 * @throws InvalidConfigurationException
	 */
	public void validate() {
		if (queueName == null || queueName.trim().isEmpty()) {
			throw new InvalidConfigurationException("Queue name cannot be empty");
		}
		if (getMaxMessages() < 1) {
			throw new InvalidConfigurationException(
					"Max messages per poll must be at least one but was: " + getMaxMessages());
		}
		double timeout = getReceiveTimeoutSeconds();
		if (Double.isNaN(timeout) || Double.isInfinite(timeout) || timeout <= 0) {
			throw new InvalidConfigurationException("Receive timeout must be a positive number of seconds but was: "
					+ timeout);
		}
		if (getReceiveTimeout().isZero()) {
			throw new InvalidConfigurationException("Receive timeout must be at least one millisecond but was: "
					+ timeout + " seconds");
		}
	}
}
