package org.flowblocks.workers.block;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flowblocks.workers.GatedRunner;
import org.flowblocks.workers.lifecycle.BlockHealth;
import org.flowblocks.workers.lifecycle.HealthStatusSurface;
import org.flowblocks.workers.message.MessageSink;
import org.flowblocks.workers.session.QueueSessionFactory;
import org.flowblocks.workers.state.ConsumerStateStore;

/**
 * A standalone subscription worker consists of three layers:
 * <ol>
 * <li>GatedRunner - Runs each scheduled trigger until the block is drained and
 * reports escaped failures to the lifecycle.</li>
 * <li>QueueSubscriptionBlock - Decides per trigger whether to poll or to
 * re-probe, based on the block's health.</li>
 * <li>PollCycleController - Receives, acknowledges and emits one batch.</li>
 * </ol>
 * {@link #start(ScheduledExecutorService)} activates the block and schedules
 * the trigger with a fixed delay, so cycles never overlap.
 *
 */
public class SubscriptionWorkerStack implements Runnable {

	private static final Logger log = LogManager.getLogger(SubscriptionWorkerStack.class);

	private final QueueSubscriptionBlock block;
	private final Runnable runner;
	private ScheduledFuture<?> scheduled;

	public SubscriptionWorkerStack(QueueSessionFactory sessionFactory, ConsumerStateStore stateStore,
			MessageSink<Object> eventSink, HealthStatusSurface surface,
			SubscriptionWorkerStackConfiguration config) {
		if (config == null) {
			throw new IllegalArgumentException("SubscriptionWorkerStackConfiguration cannot be null");
		}
		config.getSchedule().validate();
		BlockContext context = new BlockContext();
		context.setAppConfiguration(config.getAppConfiguration());
		context.setPollConfiguration(config.getPollConfiguration());
		context.setSchedule(config.getSchedule());
		context.setSessionFactory(sessionFactory);
		context.setStateStore(stateStore);
		context.setEventSink(eventSink);
		context.setHealthStatusSurface(surface);
		this.block = new QueueSubscriptionBlock(context);
		this.runner = new GatedRunner(block.getLifecycle(), block::onTrigger);
	}

	/**
	 * Activate the block and schedule its trigger on the executor.
	 * 
	 * @param executor
	 * @return The health after activation.
	 */
	public synchronized BlockHealth start(ScheduledExecutorService executor) {
		if (executor == null) {
			throw new IllegalArgumentException("ScheduledExecutorService cannot be null");
		}
		if (scheduled != null) {
			throw new IllegalStateException("Worker is already started");
		}
		BlockHealth health = block.onSync();
		ScheduleDefinition schedule = block.getSchedule();
		log.info("Starting subscription worker " + schedule + " with health: " + health);
		scheduled = executor.scheduleWithFixedDelay(this, schedule.getInterval(), schedule.getInterval(),
				schedule.getUnit());
		return health;
	}

	/**
	 * Drain the block and stop scheduling it. Terminal.
	 * 
	 * @return
	 */
	public synchronized BlockHealth drain() {
		if (scheduled != null) {
			scheduled.cancel(false);
		}
		return block.onDrain();
	}

	@Override
	public void run() {
		runner.run();
	}

	public QueueSubscriptionBlock getBlock() {
		return block;
	}
}
