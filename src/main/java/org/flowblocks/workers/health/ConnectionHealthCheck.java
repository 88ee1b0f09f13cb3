package org.flowblocks.workers.health;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flowblocks.workers.InvalidConfigurationException;
import org.flowblocks.workers.poll.ErrorKind;
import org.flowblocks.workers.poll.PollCycleConfiguration;
import org.flowblocks.workers.session.ConnectivityException;
import org.flowblocks.workers.session.ConsumerCredential;
import org.flowblocks.workers.session.QueueSession;
import org.flowblocks.workers.session.QueueSessionFactory;

/**
 * Validates configuration and reachability of a queue without consuming from
 * it. The probe opens a session, peeks at most one message and closes the
 * session. An empty queue is a successful probe.
 *
 */
public class ConnectionHealthCheck {

	private static final Logger log = LogManager.getLogger(ConnectionHealthCheck.class);

	public static final String DEFAULT_FAILURE_DESCRIPTION = "Connection failed";

	private final QueueSessionFactory sessionFactory;

	public ConnectionHealthCheck(QueueSessionFactory sessionFactory) {
		if (sessionFactory == null) {
			throw new IllegalArgumentException("QueueSessionFactory cannot be null");
		}
		this.sessionFactory = sessionFactory;
	}

	/**
	 * Probe the configured queue. Never throws.
	 * 
	 * @param config
	 * @param credential
	 * @return
	 */
	public ProbeResult probe(PollCycleConfiguration config, ConsumerCredential credential) {
		try {
			if (config == null) {
				throw new InvalidConfigurationException("Poll configuration cannot be null");
			}
			config.validate();
			if (credential == null) {
				throw new InvalidConfigurationException("Credential cannot be null");
			}
			int maxMessages = config.getMaxMessages();
			int ceiling = sessionFactory.getProvider().getMaxBatchSize();
			if (maxMessages > ceiling) {
				log.info("Max messages per poll (" + maxMessages + ") exceeds the limit and will be truncated to "
						+ ceiling);
			}
			try (QueueSession session = sessionFactory.open(credential, config.getQueueName())) {
				session.peek(1);
			}
			log.info("Probe of queue: " + config.getQueueName() + " succeeded");
			return ProbeResult.success();
		} catch (InvalidConfigurationException e) {
			log.error("Invalid configuration: " + e.getMessage());
			return ProbeResult.failure(ErrorKind.CONFIGURATION, e.getMessage());
		} catch (ConnectivityException e) {
			String description = describe(e);
			log.error("Probe failed: " + description);
			return ProbeResult.failure(ErrorKind.CONNECTIVITY, description);
		} catch (RuntimeException e) {
			String description = describe(e);
			log.error("Probe failed: " + description, e);
			return ProbeResult.failure(ErrorKind.CONNECTIVITY, description);
		}
	}

	/**
	 * Build the human readable description of a probe failure. When the root
	 * cause carries suppressed errors every message is listed.
	 * 
	 * @param error
	 * @return
	 */
	static String describe(Throwable error) {
		Throwable root = error;
		if (error instanceof ConnectivityException && error.getCause() != null) {
			root = error.getCause();
		}
		Throwable[] suppressed = root.getSuppressed();
		if (suppressed.length > 0) {
			List<String> messages = new ArrayList<>();
			for (Throwable t : suppressed) {
				messages.add(t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage());
			}
			return "AggregateError: " + String.join("; ", messages);
		}
		if (error.getMessage() != null && !error.getMessage().isEmpty()) {
			return error.getMessage();
		}
		return DEFAULT_FAILURE_DESCRIPTION;
	}
}
