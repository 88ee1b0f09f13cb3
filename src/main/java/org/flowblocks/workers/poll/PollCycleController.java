package org.flowblocks.workers.poll;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flowblocks.workers.Clock;
import org.flowblocks.workers.InvalidConfigurationException;
import org.flowblocks.workers.message.MessageNormalizer;
import org.flowblocks.workers.message.MessageSink;
import org.flowblocks.workers.message.NormalizedMessage;
import org.flowblocks.workers.message.QueueMessage;
import org.flowblocks.workers.session.AcknowledgmentException;
import org.flowblocks.workers.session.ConnectivityException;
import org.flowblocks.workers.session.ConsumerCredential;
import org.flowblocks.workers.session.QueueSession;
import org.flowblocks.workers.session.QueueSessionFactory;
import org.flowblocks.workers.state.ConsumerStateTracker;

/**
 * Runs a single receive, normalize, acknowledge, emit pass against a queue.
 * <p>
 * Each received message is normalized, then acknowledged, then emitted before
 * the next message is touched. A rejected acknowledgment aborts the rest of
 * the batch. Messages that were already emitted stay emitted, so delivery is
 * at-least-once. The session is always closed and the consumer state is
 * always updated, whatever the outcome.
 * <p>
 * This class never throws from {@link #runCycle(PollCycleConfiguration, ConsumerCredential)};
 * failures are reported through the returned {@link PollCycleResult}.
 *
 */
public class PollCycleController {

	private static final Logger log = LogManager.getLogger(PollCycleController.class);

	private final QueueSessionFactory sessionFactory;
	private final MessageNormalizer normalizer;
	private final MessageSink<? super NormalizedMessage> sink;
	private final ConsumerStateTracker stateTracker;
	private final Clock clock;

	public PollCycleController(QueueSessionFactory sessionFactory, MessageNormalizer normalizer,
			MessageSink<? super NormalizedMessage> sink, ConsumerStateTracker stateTracker, Clock clock) {
		if (sessionFactory == null) {
			throw new IllegalArgumentException("QueueSessionFactory cannot be null");
		}
		if (normalizer == null) {
			throw new IllegalArgumentException("MessageNormalizer cannot be null");
		}
		if (sink == null) {
			throw new IllegalArgumentException("MessageSink cannot be null");
		}
		if (stateTracker == null) {
			throw new IllegalArgumentException("ConsumerStateTracker cannot be null");
		}
		if (clock == null) {
			throw new IllegalArgumentException("Clock cannot be null");
		}
		this.sessionFactory = sessionFactory;
		this.normalizer = normalizer;
		this.sink = sink;
		this.stateTracker = stateTracker;
		this.clock = clock;
	}

	/**
	 * Run one poll cycle.
	 * 
	 * @param config
	 * @param credential
	 * @return
	 */
	public PollCycleResult runCycle(PollCycleConfiguration config, ConsumerCredential credential) {
		List<String> warnings = new ArrayList<>();
		List<NormalizedMessage> emitted = new ArrayList<>();
		int receivedCount = 0;
		PollCycleResult result;
		try {
			if (config == null) {
				throw new InvalidConfigurationException("Poll configuration cannot be null");
			}
			config.validate();
			if (credential == null) {
				throw new InvalidConfigurationException("Credential cannot be null");
			}
			int batchSize = clampBatchSize(config.getMaxMessages(), warnings);
			try (QueueSession session = sessionFactory.open(credential, config.getQueueName())) {
				List<QueueMessage> received = session.receive(batchSize, config.getReceiveTimeout());
				receivedCount = received.size();
				log.info("Received " + receivedCount + " message(s) from queue: " + config.getQueueName());
				for (QueueMessage message : received) {
					NormalizedMessage normalized = normalizer.normalize(message);
					session.acknowledge(message);
					emit(normalized);
					emitted.add(normalized);
				}
			}
			result = PollCycleResult.ok(receivedCount, emitted, warnings);
		} catch (InvalidConfigurationException e) {
			log.error("Invalid poll configuration: " + e.getMessage());
			result = PollCycleResult.error(receivedCount, emitted, ErrorKind.CONFIGURATION, e.getMessage(),
					warnings);
		} catch (AcknowledgmentException e) {
			log.error("Aborting batch after " + emitted.size() + " of " + receivedCount + " message(s): "
					+ e.getMessage(), e);
			result = PollCycleResult.error(receivedCount, emitted, ErrorKind.ACKNOWLEDGMENT, e.getMessage(),
					warnings);
		} catch (ConnectivityException e) {
			log.error("Poll cycle failed: " + e.getMessage(), e);
			result = PollCycleResult.error(receivedCount, emitted, ErrorKind.CONNECTIVITY, e.getMessage(),
					warnings);
		} catch (RuntimeException e) {
			log.error("Poll cycle failed unexpectedly: " + e.getMessage(), e);
			result = PollCycleResult.error(receivedCount, emitted, ErrorKind.CONNECTIVITY,
					e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), warnings);
		}
		recordState(receivedCount);
		return result;
	}

	/**
	 * Clamp the configured batch size to the provider's ceiling.
	 * 
	 * @param maxMessages
	 * @param warnings    Receives a warning when the value was clamped.
	 * @return
	 */
	int clampBatchSize(int maxMessages, List<String> warnings) {
		int ceiling = sessionFactory.getProvider().getMaxBatchSize();
		if (maxMessages > ceiling) {
			String warning = "Max messages per poll (" + maxMessages + ") exceeds the limit and will be truncated to "
					+ ceiling;
			log.warn(warning);
			warnings.add(warning);
			return ceiling;
		}
		return maxMessages;
	}

	private void emit(NormalizedMessage message) {
		try {
			sink.emit(message);
		} catch (RuntimeException e) {
			// the message is already acknowledged so the batch keeps going.
			log.warn("Failed to emit message: " + message.getMessageId() + ": " + e.getMessage(), e);
		}
	}

	private void recordState(int receivedCount) {
		long now = clock.currentTimeMillis();
		try {
			stateTracker.recordCheck(now);
			if (receivedCount > 0) {
				stateTracker.recordMessageReceived(now);
			}
		} catch (RuntimeException e) {
			log.error("Failed to record consumer state: " + e.getMessage(), e);
		}
	}
}
