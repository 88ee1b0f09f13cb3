package org.flowblocks.workers.azure.message;

import org.flowblocks.workers.message.QueueMessage;

import com.azure.core.amqp.models.AmqpMessageBody;
import com.azure.messaging.servicebus.ServiceBusReceivedMessage;

/**
 * Maps a received Service Bus message onto a {@link QueueMessage}. The original
 * message is kept as the delivery handle because completing it requires the
 * instance that was received.
 *
 */
public class ServiceBusMessageConverter {

	public QueueMessage convert(ServiceBusReceivedMessage message) {
		return QueueMessage.builder()
				.body(extractBody(message))
				.messageId(message.getMessageId())
				.enqueuedTime(message.getEnqueuedTime() == null ? null : message.getEnqueuedTime().toInstant())
				.sequenceNumber(message.getSequenceNumber())
				.contentType(message.getContentType())
				.correlationId(message.getCorrelationId())
				.applicationProperties(message.getApplicationProperties())
				.deliveryHandle(message)
				.build();
	}

	/**
	 * Binary data sections are returned as bytes. AMQP value and sequence
	 * sections are returned as the decoded objects.
	 * 
	 * @param message
	 * @return
	 */
	Object extractBody(ServiceBusReceivedMessage message) {
		if (message.getRawAmqpMessage() == null) {
			return message.getBody() == null ? null : message.getBody().toBytes();
		}
		AmqpMessageBody body = message.getRawAmqpMessage().getBody();
		if (body == null) {
			return null;
		}
		switch (body.getBodyType()) {
		case VALUE:
			return body.getValue();
		case SEQUENCE:
			return body.getSequence();
		case DATA:
		default:
			return body.getFirstData();
		}
	}
}
