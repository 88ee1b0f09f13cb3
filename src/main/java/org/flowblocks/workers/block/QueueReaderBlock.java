package org.flowblocks.workers.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flowblocks.workers.InvalidConfigurationException;
import org.flowblocks.workers.lifecycle.BlockHealth;
import org.flowblocks.workers.message.MessageNormalizer;
import org.flowblocks.workers.message.NormalizedMessage;
import org.flowblocks.workers.message.Timestamps;
import org.flowblocks.workers.poll.PollCycleConfiguration;
import org.flowblocks.workers.poll.PollCycleController;
import org.flowblocks.workers.poll.PollCycleResult;
import org.flowblocks.workers.session.ConsumerCredential;
import org.flowblocks.workers.state.ConsumerStateTracker;
import org.flowblocks.workers.state.InMemoryConsumerStateStore;

/**
 * Reads at most one message each time it is triggered and emits a
 * {@link ReadResult}. The message is acknowledged before the result is
 * emitted. Every failure becomes a {@link ReadResult.Status#ERROR} event.
 * <p>
 * The reader keeps no consumer state between triggers.
 *
 */
public class QueueReaderBlock implements Block {

	private static final Logger log = LogManager.getLogger(QueueReaderBlock.class);

	public static final int READ_MAX_MESSAGES = 1;
	public static final double READ_TIMEOUT_SECONDS = 1;

	private final BlockContext context;
	private final MessageNormalizer normalizer;

	public QueueReaderBlock(BlockContext context) {
		if (context == null) {
			throw new IllegalArgumentException("BlockContext cannot be null");
		}
		context.validate();
		this.context = context;
		this.normalizer = new MessageNormalizer(true);
	}

	@Override
	public BlockKind getKind() {
		return BlockKind.QUEUE_READER;
	}

	@Override
	public List<ConfigField> getConfigFields() {
		return Collections.singletonList(new ConfigField("queueName", "Queue Name",
				"Name of the queue to read messages from", ConfigField.Type.STRING, true, null));
	}

	@Override
	public BlockHealth onSync() {
		return BlockHealth.ready();
	}

	@Override
	public BlockHealth onDrain() {
		return BlockHealth.drained();
	}

	/**
	 * Read one message and emit the result.
	 */
	@Override
	public void onTrigger() {
		String checkedAt = Timestamps.format(context.getClock().currentTimeMillis());
		ReadResult result;
		try {
			ConsumerCredential credential = context.getAppConfiguration().toCredential(context.getClock());
			List<NormalizedMessage> received = new ArrayList<>();
			PollCycleController controller = new PollCycleController(context.getSessionFactory(), normalizer,
					received::add, new ConsumerStateTracker(new InMemoryConsumerStateStore()), context.getClock());
			PollCycleResult cycle = controller.runCycle(readConfiguration(), credential);
			if (cycle.isOk()) {
				result = new ReadResult(ReadResult.Status.CONNECTED, checkedAt,
						received.isEmpty() ? null : received.get(0));
			} else {
				result = new ReadResult(ReadResult.Status.ERROR, checkedAt, null);
			}
		} catch (InvalidConfigurationException e) {
			log.error("Invalid configuration: " + e.getMessage());
			result = new ReadResult(ReadResult.Status.ERROR, checkedAt, null);
		}
		context.getEventSink().emit(result);
	}

	/**
	 * The block's queue with a single message batch and a short wait.
	 * 
	 * @return
	 */
	PollCycleConfiguration readConfiguration() {
		PollCycleConfiguration config = new PollCycleConfiguration(context.getPollConfiguration().getQueueName());
		config.setMaxMessages(READ_MAX_MESSAGES);
		config.setReceiveTimeoutSeconds(READ_TIMEOUT_SECONDS);
		return config;
	}
}
