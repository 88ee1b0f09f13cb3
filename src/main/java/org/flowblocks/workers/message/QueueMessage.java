package org.flowblocks.workers.message;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message as it was received from a queue provider, before normalization.
 * <p>
 * Every field other than the delivery handle is optional. The body may be a
 * {@link String}, a <code>byte[]</code> or any structured value the provider
 * decoded (for example an AMQP value section).
 * <p>
 * The delivery handle is the provider specific token that the
 * {@link org.flowblocks.workers.session.QueueSession} that received the
 * message needs to acknowledge it. It is never exposed to the emission sink.
 *
 */
public class QueueMessage {

	private final Object body;
	private final String messageId;
	private final Instant enqueuedTime;
	private final BigInteger sequenceNumber;
	private final String contentType;
	private final String correlationId;
	private final Map<String, Object> applicationProperties;
	private final Object deliveryHandle;

	private QueueMessage(Builder builder) {
		this.body = builder.body;
		this.messageId = builder.messageId;
		this.enqueuedTime = builder.enqueuedTime;
		this.sequenceNumber = builder.sequenceNumber;
		this.contentType = builder.contentType;
		this.correlationId = builder.correlationId;
		this.applicationProperties = builder.applicationProperties == null ? null
				: Collections.unmodifiableMap(new LinkedHashMap<>(builder.applicationProperties));
		this.deliveryHandle = builder.deliveryHandle;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Object getBody() {
		return body;
	}

	public String getMessageId() {
		return messageId;
	}

	public Instant getEnqueuedTime() {
		return enqueuedTime;
	}

	public BigInteger getSequenceNumber() {
		return sequenceNumber;
	}

	public String getContentType() {
		return contentType;
	}

	public String getCorrelationId() {
		return correlationId;
	}

	/**
	 * @return The application properties or null if the provider supplied none.
	 */
	public Map<String, Object> getApplicationProperties() {
		return applicationProperties;
	}

	/**
	 * The provider specific handle used to acknowledge this message.
	 * 
	 * @return
	 */
	public Object getDeliveryHandle() {
		return deliveryHandle;
	}

	@Override
	public String toString() {
		return "QueueMessage [messageId=" + messageId + ", sequenceNumber=" + sequenceNumber + ", enqueuedTime="
				+ enqueuedTime + "]";
	}

	public static class Builder {

		private Object body;
		private String messageId;
		private Instant enqueuedTime;
		private BigInteger sequenceNumber;
		private String contentType;
		private String correlationId;
		private Map<String, Object> applicationProperties;
		private Object deliveryHandle;

		private Builder() {
		}

		public Builder body(Object body) {
			this.body = body;
			return this;
		}

		public Builder messageId(String messageId) {
			this.messageId = messageId;
			return this;
		}

		public Builder enqueuedTime(Instant enqueuedTime) {
			this.enqueuedTime = enqueuedTime;
			return this;
		}

		public Builder sequenceNumber(BigInteger sequenceNumber) {
			this.sequenceNumber = sequenceNumber;
			return this;
		}

		public Builder sequenceNumber(long sequenceNumber) {
			this.sequenceNumber = BigInteger.valueOf(sequenceNumber);
			return this;
		}

		public Builder contentType(String contentType) {
			this.contentType = contentType;
			return this;
		}

		public Builder correlationId(String correlationId) {
			this.correlationId = correlationId;
			return this;
		}

		public Builder applicationProperties(Map<String, Object> applicationProperties) {
			this.applicationProperties = applicationProperties;
			return this;
		}

		public Builder deliveryHandle(Object deliveryHandle) {
			this.deliveryHandle = deliveryHandle;
			return this;
		}

		public QueueMessage build() {
			return new QueueMessage(this);
		}
	}
}
