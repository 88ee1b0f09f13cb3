package org.flowblocks.workers.aws.message;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flowblocks.workers.session.ConnectivityException;
import org.flowblocks.workers.session.ConsumerCredential;
import org.flowblocks.workers.session.QueueProvider;
import org.flowblocks.workers.session.QueueSession;
import org.flowblocks.workers.session.QueueSessionFactory;

import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;
import software.amazon.awssdk.services.sqs.model.QueueDoesNotExistException;

/**
 * Opens sessions over a shared {@link SqsClient}.
 * <p>
 * The client carries its own AWS credentials. The {@link ConsumerCredential}
 * passed to {@link #open(ConsumerCredential, String)} is ignored and may be
 * null.
 *
 */
public class SqsQueueSessionFactory implements QueueSessionFactory {

	private static final Logger log = LogManager.getLogger(SqsQueueSessionFactory.class);

	private final SqsClient sqsClient;

	public SqsQueueSessionFactory(SqsClient sqsClient) {
		if (sqsClient == null) {
			throw new IllegalArgumentException("SqsClient cannot be null");
		}
		this.sqsClient = sqsClient;
	}

	/**
	 * Resolve the queue URL. The credential is ignored.
	 */
	@Override
	public QueueSession open(ConsumerCredential credential, String queueName) throws ConnectivityException {
		if (queueName == null) {
			throw new IllegalArgumentException("QueueName cannot be null");
		}
		String queueUrl;
		try {
			queueUrl = sqsClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(queueName).build()).queueUrl();
		} catch (QueueDoesNotExistException e) {
			throw new ConnectivityException("Queue: " + queueName + " does not exist", e);
		} catch (RuntimeException e) {
			throw new ConnectivityException("Failed to connect to queue: " + queueName + ": " + e.getMessage(), e);
		}
		log.debug("Resolved queue: " + queueName + " to URL: " + queueUrl);
		return new SqsQueueSession(queueName, queueUrl, sqsClient);
	}

	@Override
	public QueueProvider getProvider() {
		return QueueProvider.SQS;
	}

}
