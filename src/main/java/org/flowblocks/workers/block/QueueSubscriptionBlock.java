package org.flowblocks.workers.block;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flowblocks.workers.InvalidConfigurationException;
import org.flowblocks.workers.health.ConnectionHealthCheck;
import org.flowblocks.workers.health.ProbeResult;
import org.flowblocks.workers.lifecycle.BlockHealth;
import org.flowblocks.workers.lifecycle.HealthStatus;
import org.flowblocks.workers.lifecycle.LifecycleStateMachine;
import org.flowblocks.workers.message.MessageNormalizer;
import org.flowblocks.workers.poll.ErrorKind;
import org.flowblocks.workers.poll.PollCycleConfiguration;
import org.flowblocks.workers.poll.PollCycleController;
import org.flowblocks.workers.poll.PollCycleResult;
import org.flowblocks.workers.session.ConsumerCredential;
import org.flowblocks.workers.state.ConsumerStateTracker;

/**
 * Polls a queue on a fixed schedule and emits every received message.
 * <p>
 * On each scheduled trigger:
 * <ul>
 * <li>FAILED: run a recovery probe instead of polling</li>
 * <li>READY: run a poll cycle; a failed cycle requests a re-probe</li>
 * <li>anything else: do nothing</li>
 * </ul>
 * Triggers and the lifecycle hooks are serialized on this block, so a drain
 * requested while a poll is in flight waits for that poll to finish before it
 * clears the consumer state.
 *
 */
public class QueueSubscriptionBlock implements Block {

	private static final Logger log = LogManager.getLogger(QueueSubscriptionBlock.class);

	private final BlockContext context;
	private final ConsumerStateTracker stateTracker;
	private final PollCycleController controller;
	private final ConnectionHealthCheck healthCheck;
	private final LifecycleStateMachine lifecycle;

	public QueueSubscriptionBlock(BlockContext context) {
		if (context == null) {
			throw new IllegalArgumentException("BlockContext cannot be null");
		}
		context.validate();
		this.context = context;
		this.stateTracker = new ConsumerStateTracker(context.getStateStore());
		this.controller = new PollCycleController(context.getSessionFactory(), new MessageNormalizer(false),
				context.getEventSink(), stateTracker, context.getClock());
		this.healthCheck = new ConnectionHealthCheck(context.getSessionFactory());
		this.lifecycle = new LifecycleStateMachine(this::probe, stateTracker, context.getHealthStatusSurface());
	}

	@Override
	public BlockKind getKind() {
		return BlockKind.QUEUE_SUBSCRIPTION;
	}

	@Override
	public List<ConfigField> getConfigFields() {
		return Collections.unmodifiableList(Arrays.asList(
				new ConfigField("queueName", "Queue Name", "Name of the queue to subscribe to",
						ConfigField.Type.STRING, true, null),
				new ConfigField("maxMessages", "Max Messages per Poll",
						"Maximum number of messages to receive per poll cycle (default: "
								+ PollCycleConfiguration.DEFAULT_MAX_MESSAGES + ", max: "
								+ context.getSessionFactory().getProvider().getMaxBatchSize() + ")",
						ConfigField.Type.NUMBER, false, PollCycleConfiguration.DEFAULT_MAX_MESSAGES),
				new ConfigField("receiveTimeoutSeconds", "Receive Timeout (seconds)",
						"How long to wait for messages before returning (default: 5)", ConfigField.Type.NUMBER,
						false, PollCycleConfiguration.DEFAULT_RECEIVE_TIMEOUT_SECONDS)));
	}

	/**
	 * The operator configurable schedule this block's trigger runs on.
	 * 
	 * @return
	 */
	public ScheduleDefinition getSchedule() {
		return context.getSchedule();
	}

	@Override
	public synchronized BlockHealth onSync() {
		return lifecycle.activate();
	}

	@Override
	public synchronized BlockHealth onDrain() {
		return lifecycle.drain();
	}

	@Override
	public synchronized void onTrigger() {
		HealthStatus status = lifecycle.getStatus();
		if (status == HealthStatus.FAILED) {
			if (lifecycle.shouldReprobe()) {
				lifecycle.reprobe();
			}
			return;
		}
		if (status != HealthStatus.READY) {
			log.debug("Skipping poll for block in status: " + status);
			return;
		}
		PollCycleResult result = poll();
		if (!result.isOk()) {
			log.info("Poll cycle reported " + result.getErrorKind() + ": " + result.getDiagnostic());
		}
		lifecycle.onPollResult(result);
	}

	/**
	 * Run one poll cycle with the current configuration.
	 * 
	 * @return
	 */
	PollCycleResult poll() {
		ConsumerCredential credential;
		try {
			credential = context.getAppConfiguration().toCredential(context.getClock());
		} catch (InvalidConfigurationException e) {
			stateTracker.recordCheck(context.getClock().currentTimeMillis());
			return PollCycleResult.error(0, Collections.emptyList(), ErrorKind.CONFIGURATION, e.getMessage(),
					Collections.emptyList());
		}
		return controller.runCycle(context.getPollConfiguration(), credential);
	}

	/**
	 * Probe the configured queue with a freshly built credential.
	 * 
	 * @return
	 */
	ProbeResult probe() {
		ConsumerCredential credential;
		try {
			credential = context.getAppConfiguration().toCredential(context.getClock());
		} catch (InvalidConfigurationException e) {
			return ProbeResult.failure(ErrorKind.CONFIGURATION, e.getMessage());
		}
		return healthCheck.probe(context.getPollConfiguration(), credential);
	}

	public LifecycleStateMachine getLifecycle() {
		return lifecycle;
	}

	public ConsumerStateTracker getStateTracker() {
		return stateTracker;
	}
}
