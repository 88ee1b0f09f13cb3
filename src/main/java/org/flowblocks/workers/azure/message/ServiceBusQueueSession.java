package org.flowblocks.workers.azure.message;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.flowblocks.workers.message.QueueMessage;
import org.flowblocks.workers.session.AbstractQueueSession;
import org.flowblocks.workers.session.AcknowledgmentException;
import org.flowblocks.workers.session.ConnectivityException;

import com.azure.core.util.IterableStream;
import com.azure.messaging.servicebus.ServiceBusReceivedMessage;
import com.azure.messaging.servicebus.ServiceBusReceiverClient;

/**
 * A session backed by a peek-lock {@link ServiceBusReceiverClient}. The
 * receiver owns its own AMQP connection, which is released on close.
 *
 */
public class ServiceBusQueueSession extends AbstractQueueSession {

	private final ServiceBusReceiverClient receiver;
	private final ServiceBusMessageConverter converter;

	public ServiceBusQueueSession(String queueName, ServiceBusReceiverClient receiver,
			ServiceBusMessageConverter converter) {
		super(queueName);
		if (receiver == null) {
			throw new IllegalArgumentException("ServiceBusReceiverClient cannot be null");
		}
		if (converter == null) {
			throw new IllegalArgumentException("ServiceBusMessageConverter cannot be null");
		}
		this.receiver = receiver;
		this.converter = converter;
	}

	@Override
	public List<QueueMessage> receive(int maxCount, Duration timeout) throws ConnectivityException {
		assertOpen();
		try {
			return convertAll(receiver.receiveMessages(maxCount, timeout));
		} catch (RuntimeException e) {
			throw new ConnectivityException(
					"Failed to receive messages from queue: " + getQueueName() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public void acknowledge(QueueMessage message) throws AcknowledgmentException {
		assertOpen();
		if (!(message.getDeliveryHandle() instanceof ServiceBusReceivedMessage)) {
			throw new IllegalArgumentException("Message was not received from a Service Bus session: " + message);
		}
		try {
			receiver.complete((ServiceBusReceivedMessage) message.getDeliveryHandle());
		} catch (RuntimeException e) {
			throw new AcknowledgmentException(
					"Failed to complete message: " + message.getMessageId() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public List<QueueMessage> peek(int count) throws ConnectivityException {
		assertOpen();
		try {
			return convertAll(receiver.peekMessages(count));
		} catch (RuntimeException e) {
			throw new ConnectivityException(
					"Failed to peek messages from queue: " + getQueueName() + ": " + e.getMessage(), e);
		}
	}

	@Override
	protected void doClose() {
		receiver.close();
	}

	private List<QueueMessage> convertAll(IterableStream<ServiceBusReceivedMessage> received) {
		List<QueueMessage> messages = new ArrayList<>();
		if (received == null) {
			return messages;
		}
		for (ServiceBusReceivedMessage message : received) {
			messages.add(converter.convert(message));
		}
		return messages;
	}
}
