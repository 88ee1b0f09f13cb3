package org.flowblocks.workers.block;

import java.util.concurrent.TimeUnit;

import org.flowblocks.workers.poll.PollCycleConfiguration;
import org.flowblocks.workers.session.ConsumerAppConfiguration;

/**
 * Wrapper for all of the Configuration needed to create a
 * SubscriptionWorkerStack.
 *
 */
public class SubscriptionWorkerStackConfiguration {

	ConsumerAppConfiguration appConfiguration;
	PollCycleConfiguration pollConfiguration;
	ScheduleDefinition schedule;

	public SubscriptionWorkerStackConfiguration() {
		appConfiguration = new ConsumerAppConfiguration();
		pollConfiguration = new PollCycleConfiguration();
		schedule = new ScheduleDefinition();
	}

	public ConsumerAppConfiguration getAppConfiguration() {
		return appConfiguration;
	}

	public PollCycleConfiguration getPollConfiguration() {
		return pollConfiguration;
	}

	public ScheduleDefinition getSchedule() {
		return schedule;
	}

	/**
	 * The name of queue.
	 * 
	 * @param queueName
	 */
	public void setQueueName(String queueName) {
		pollConfiguration.setQueueName(queueName);
	}

	/**
	 * Maximum number of messages to receive per poll cycle.
	 * 
	 * @param maxMessages
	 */
	public void setMaxMessages(Integer maxMessages) {
		pollConfiguration.setMaxMessages(maxMessages);
	}

	/**
	 * How long each poll waits for messages.
	 * 
	 * @param receiveTimeoutSeconds
	 */
	public void setReceiveTimeoutSeconds(Double receiveTimeoutSeconds) {
		pollConfiguration.setReceiveTimeoutSeconds(receiveTimeoutSeconds);
	}

	/**
	 * Fully qualified namespace and a bearer token for it.
	 * 
	 * @param namespace
	 * @param accessToken
	 * @param accessTokenExpiry Optional epoch millis the token expires.
	 */
	public void setAccessToken(String namespace, String accessToken, Long accessTokenExpiry) {
		appConfiguration.setNamespace(namespace);
		appConfiguration.setAccessToken(accessToken);
		appConfiguration.setAccessTokenExpiry(accessTokenExpiry);
	}

	/**
	 * A connection string. Takes precedence over an access token.
	 * 
	 * @param connectionString
	 */
	public void setConnectionString(String connectionString) {
		appConfiguration.setConnectionString(connectionString);
	}

	/**
	 * How often the queue is polled.
	 * 
	 * @param interval
	 * @param unit
	 */
	public void setPollInterval(long interval, TimeUnit unit) {
		schedule.setInterval(interval);
		schedule.setUnit(unit);
	}
}
