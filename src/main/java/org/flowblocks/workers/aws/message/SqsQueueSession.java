package org.flowblocks.workers.aws.message;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flowblocks.workers.message.QueueMessage;
import org.flowblocks.workers.session.AbstractQueueSession;
import org.flowblocks.workers.session.AcknowledgmentException;
import org.flowblocks.workers.session.ConnectivityException;
import org.flowblocks.workers.session.QueueProvider;

import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

/**
 * A session over an AWS SQS queue. The {@link SqsClient} is shared and owned by
 * the caller, so closing the session does not close the client.
 * <p>
 * SQS cannot browse a queue without hiding the messages it returns. Instead of
 * returning messages, {@link #peek(int)} reads the queue attributes to prove
 * the queue is reachable and returns an empty list.
 *
 */
public class SqsQueueSession extends AbstractQueueSession {

	private static final Logger log = LogManager.getLogger(SqsQueueSession.class);

	/*
	 * The longest long poll SQS supports.
	 */
	public static final int MAX_WAIT_TIME_SEC = 20;

	public static final String ATTRIBUTE_SENT_TIMESTAMP = "SentTimestamp";
	public static final String ATTRIBUTE_SEQUENCE_NUMBER = "SequenceNumber";
	public static final String MESSAGE_ATTRIBUTE_CONTENT_TYPE = "contentType";
	public static final String MESSAGE_ATTRIBUTE_CORRELATION_ID = "correlationId";

	private final SqsClient sqsClient;
	private final String queueUrl;

	public SqsQueueSession(String queueName, String queueUrl, SqsClient sqsClient) {
		super(queueName);
		if (sqsClient == null) {
			throw new IllegalArgumentException("SqsClient cannot be null");
		}
		if (queueUrl == null) {
			throw new IllegalArgumentException("QueueUrl cannot be null");
		}
		this.sqsClient = sqsClient;
		this.queueUrl = queueUrl;
	}

	public String getQueueUrl() {
		return queueUrl;
	}

	@Override
	public List<QueueMessage> receive(int maxCount, Duration timeout) throws ConnectivityException {
		assertOpen();
		ReceiveMessageRequest request = ReceiveMessageRequest.builder()
				.queueUrl(queueUrl)
				.maxNumberOfMessages(Math.min(maxCount, QueueProvider.SQS.getMaxBatchSize()))
				.waitTimeSeconds(toWaitTimeSeconds(timeout))
				.attributeNamesWithStrings("All")
				.messageAttributeNames("All")
				.build();
		ReceiveMessageResponse response;
		try {
			response = sqsClient.receiveMessage(request);
		} catch (RuntimeException e) {
			throw new ConnectivityException(
					"Failed to receive messages from queue: " + getQueueName() + ": " + e.getMessage(), e);
		}
		List<QueueMessage> messages = new ArrayList<>();
		if (response != null && response.hasMessages()) {
			for (Message message : response.messages()) {
				messages.add(convert(message));
			}
		}
		return messages;
	}

	@Override
	public void acknowledge(QueueMessage message) throws AcknowledgmentException {
		assertOpen();
		if (!(message.getDeliveryHandle() instanceof String)) {
			throw new IllegalArgumentException("Message has no SQS receipt handle: " + message);
		}
		try {
			sqsClient.deleteMessage(DeleteMessageRequest.builder()
					.queueUrl(queueUrl)
					.receiptHandle((String) message.getDeliveryHandle())
					.build());
		} catch (RuntimeException e) {
			throw new AcknowledgmentException(
					"Failed to delete message: " + message.getMessageId() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public List<QueueMessage> peek(int count) throws ConnectivityException {
		assertOpen();
		try {
			sqsClient.getQueueAttributes(GetQueueAttributesRequest.builder()
					.queueUrl(queueUrl)
					.attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)
					.build());
		} catch (RuntimeException e) {
			throw new ConnectivityException(
					"Failed to read attributes of queue: " + getQueueName() + ": " + e.getMessage(), e);
		}
		return Collections.emptyList();
	}

	@Override
	protected void doClose() {
		// the client is shared.
	}

	/**
	 * Convert an SQS message. The receipt handle becomes the delivery handle and
	 * every string message attribute becomes an application property. A
	 * malformed SentTimestamp or SequenceNumber attribute is logged and left
	 * unset rather than failing the batch.
	 * 
	 * @param message
	 * @return
	 */
	QueueMessage convert(Message message) {
		Map<String, String> attributes = message.attributesAsStrings();
		Map<String, Object> properties = new LinkedHashMap<>();
		if (message.hasMessageAttributes()) {
			for (Map.Entry<String, MessageAttributeValue> entry : message.messageAttributes().entrySet()) {
				if (entry.getValue().stringValue() != null) {
					properties.put(entry.getKey(), entry.getValue().stringValue());
				}
			}
		}
		String sentTimestamp = attributes.get(ATTRIBUTE_SENT_TIMESTAMP);
		String sequenceNumber = attributes.get(ATTRIBUTE_SEQUENCE_NUMBER);
		return QueueMessage.builder()
				.body(message.body())
				.messageId(message.messageId())
				.enqueuedTime(parseSentTimestamp(message.messageId(), sentTimestamp))
				.sequenceNumber(parseSequenceNumber(message.messageId(), sequenceNumber))
				.contentType((String) properties.get(MESSAGE_ATTRIBUTE_CONTENT_TYPE))
				.correlationId((String) properties.get(MESSAGE_ATTRIBUTE_CORRELATION_ID))
				.applicationProperties(properties)
				.deliveryHandle(message.receiptHandle())
				.build();
	}

	private static Instant parseSentTimestamp(String messageId, String sentTimestamp) {
		if (sentTimestamp == null) {
			return null;
		}
		try {
			return Instant.ofEpochMilli(Long.parseLong(sentTimestamp));
		} catch (NumberFormatException e) {
			log.warn("Ignoring malformed " + ATTRIBUTE_SENT_TIMESTAMP + ": " + sentTimestamp + " of message: "
					+ messageId);
			return null;
		}
	}

	private static BigInteger parseSequenceNumber(String messageId, String sequenceNumber) {
		if (sequenceNumber == null) {
			return null;
		}
		try {
			return new BigInteger(sequenceNumber);
		} catch (NumberFormatException e) {
			log.warn("Ignoring malformed " + ATTRIBUTE_SEQUENCE_NUMBER + ": " + sequenceNumber + " of message: "
					+ messageId);
			return null;
		}
	}

	static int toWaitTimeSeconds(Duration timeout) {
		long seconds = (timeout.toMillis() + 999) / 1000;
		return (int) Math.max(0, Math.min(MAX_WAIT_TIME_SEC, seconds));
	}
}
