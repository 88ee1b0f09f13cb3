package org.flowblocks.workers.azure.message;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flowblocks.workers.session.ConnectivityException;
import org.flowblocks.workers.session.ConsumerCredential;
import org.flowblocks.workers.session.QueueProvider;
import org.flowblocks.workers.session.QueueSession;
import org.flowblocks.workers.session.QueueSessionFactory;

import com.azure.messaging.servicebus.ServiceBusClientBuilder;
import com.azure.messaging.servicebus.ServiceBusReceiverClient;
import com.azure.messaging.servicebus.models.ServiceBusReceiveMode;

/**
 * Opens a new peek-lock receiver for every session. A connection string
 * credential is passed to the client builder as is. An access token
 * credential is wrapped in a {@link FixedTokenCredential} for its namespace.
 *
 */
public class ServiceBusQueueSessionFactory implements QueueSessionFactory {

	private static final Logger log = LogManager.getLogger(ServiceBusQueueSessionFactory.class);

	private final ServiceBusMessageConverter converter;

	public ServiceBusQueueSessionFactory() {
		this(new ServiceBusMessageConverter());
	}

	public ServiceBusQueueSessionFactory(ServiceBusMessageConverter converter) {
		if (converter == null) {
			throw new IllegalArgumentException("ServiceBusMessageConverter cannot be null");
		}
		this.converter = converter;
	}

	@Override
	public QueueSession open(ConsumerCredential credential, String queueName) throws ConnectivityException {
		if (credential == null) {
			throw new IllegalArgumentException("ConsumerCredential cannot be null");
		}
		if (queueName == null) {
			throw new IllegalArgumentException("QueueName cannot be null");
		}
		ServiceBusReceiverClient receiver;
		try {
			receiver = buildReceiverClient(credential, queueName);
		} catch (RuntimeException e) {
			throw new ConnectivityException("Failed to connect to queue: " + queueName + ": " + e.getMessage(), e);
		}
		log.debug("Opened Service Bus receiver for queue: " + queueName);
		return new ServiceBusQueueSession(queueName, receiver, converter);
	}

	/**
	 * Build a peek-lock receiver for the queue.
	 * 
	 * @param credential
	 * @param queueName
	 * @return
	 */
	protected ServiceBusReceiverClient buildReceiverClient(ConsumerCredential credential, String queueName) {
		ServiceBusClientBuilder builder = new ServiceBusClientBuilder();
		if (credential.getType() == ConsumerCredential.Type.CONNECTION_STRING) {
			builder.connectionString(credential.getConnectionString());
		} else {
			builder.credential(credential.getNamespace(), createTokenCredential(credential));
		}
		return builder.receiver()
				.queueName(queueName)
				.receiveMode(ServiceBusReceiveMode.PEEK_LOCK)
				.buildClient();
	}

	/**
	 * Wrap the access token of the credential, expiring when the credential
	 * does.
	 * 
	 * @param credential
	 * @return
	 */
	FixedTokenCredential createTokenCredential(ConsumerCredential credential) {
		return new FixedTokenCredential(credential.getAccessToken(), credential.getExpiresOnMillis());
	}

	@Override
	public QueueProvider getProvider() {
		return QueueProvider.SERVICE_BUS;
	}

}
