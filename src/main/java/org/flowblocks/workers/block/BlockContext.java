package org.flowblocks.workers.block;

import org.flowblocks.workers.Clock;
import org.flowblocks.workers.ClockImpl;
import org.flowblocks.workers.lifecycle.HealthStatusSurface;
import org.flowblocks.workers.message.MessageSink;
import org.flowblocks.workers.poll.PollCycleConfiguration;
import org.flowblocks.workers.session.ConsumerAppConfiguration;
import org.flowblocks.workers.session.QueueSessionFactory;
import org.flowblocks.workers.state.ConsumerStateStore;
import org.flowblocks.workers.state.InMemoryConsumerStateStore;

/**
 * Everything a block instance needs from its host: the application and block
 * configuration plus the collaborators for sessions, state, events and health.
 *
 */
public class BlockContext {

	ConsumerAppConfiguration appConfiguration = new ConsumerAppConfiguration();
	PollCycleConfiguration pollConfiguration = new PollCycleConfiguration();
	ScheduleDefinition schedule = new ScheduleDefinition();
	QueueSessionFactory sessionFactory;
	ConsumerStateStore stateStore = new InMemoryConsumerStateStore();
	MessageSink<Object> eventSink;
	HealthStatusSurface healthStatusSurface;
	Clock clock = new ClockImpl();

	public ConsumerAppConfiguration getAppConfiguration() {
		return appConfiguration;
	}

	public void setAppConfiguration(ConsumerAppConfiguration appConfiguration) {
		this.appConfiguration = appConfiguration;
	}

	/**
	 * The block level settings: queue name, batch size and receive timeout.
	 * 
	 * @return
	 */
	public PollCycleConfiguration getPollConfiguration() {
		return pollConfiguration;
	}

	public void setPollConfiguration(PollCycleConfiguration pollConfiguration) {
		this.pollConfiguration = pollConfiguration;
	}

	/**
	 * The schedule a subscription is triggered on.
	 * 
	 * @return
	 */
	public ScheduleDefinition getSchedule() {
		return schedule;
	}

	public void setSchedule(ScheduleDefinition schedule) {
		this.schedule = schedule;
	}

	public QueueSessionFactory getSessionFactory() {
		return sessionFactory;
	}

	public void setSessionFactory(QueueSessionFactory sessionFactory) {
		this.sessionFactory = sessionFactory;
	}

	/**
	 * The durable store scoped to this block instance.
	 * 
	 * @return
	 */
	public ConsumerStateStore getStateStore() {
		return stateStore;
	}

	public void setStateStore(ConsumerStateStore stateStore) {
		this.stateStore = stateStore;
	}

	/**
	 * Receives every event the block emits.
	 * 
	 * @return
	 */
	public MessageSink<Object> getEventSink() {
		return eventSink;
	}

	public void setEventSink(MessageSink<Object> eventSink) {
		this.eventSink = eventSink;
	}

	/**
	 * Optional.
	 * 
	 * @return
	 */
	public HealthStatusSurface getHealthStatusSurface() {
		return healthStatusSurface;
	}

	public void setHealthStatusSurface(HealthStatusSurface healthStatusSurface) {
		this.healthStatusSurface = healthStatusSurface;
	}

	public Clock getClock() {
		return clock;
	}

	public void setClock(Clock clock) {
		this.clock = clock;
	}

	/**
	 * @throws IllegalArgumentException When a required collaborator is missing.
	 */
	void validate() {
		if (appConfiguration == null) {
			throw new IllegalArgumentException("BlockContext.appConfiguration cannot be null");
		}
		if (pollConfiguration == null) {
			throw new IllegalArgumentException("BlockContext.pollConfiguration cannot be null");
		}
		if (sessionFactory == null) {
			throw new IllegalArgumentException("BlockContext.sessionFactory cannot be null");
		}
		if (stateStore == null) {
			throw new IllegalArgumentException("BlockContext.stateStore cannot be null");
		}
		if (eventSink == null) {
			throw new IllegalArgumentException("BlockContext.eventSink cannot be null");
		}
		if (clock == null) {
			throw new IllegalArgumentException("BlockContext.clock cannot be null");
		}
	}
}
