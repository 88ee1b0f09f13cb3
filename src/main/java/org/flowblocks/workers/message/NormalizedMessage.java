package org.flowblocks.workers.message;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The canonical form of a received message that is handed to the emission
 * sink. Instances are immutable.
 * <p>
 * The body is the parsed JSON value when the raw body was valid JSON text,
 * otherwise a JSON string holding the raw text. The raw body is only present
 * when the normalizer was asked to include it.
 *
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "body", "rawBody", "messageId", "enqueuedTime", "sequenceNumber", "contentType",
		"correlationId", "applicationProperties" })
public class NormalizedMessage {

	private final JsonNode body;
	private final String rawBody;
	private final String messageId;
	private final String enqueuedTime;
	private final String sequenceNumber;
	private final String contentType;
	private final String correlationId;
	private final Map<String, Object> applicationProperties;

	public NormalizedMessage(JsonNode body, String rawBody, String messageId, String enqueuedTime,
			String sequenceNumber, String contentType, String correlationId,
			Map<String, Object> applicationProperties) {
		this.body = body;
		this.rawBody = rawBody;
		this.messageId = messageId;
		this.enqueuedTime = enqueuedTime;
		this.sequenceNumber = sequenceNumber;
		this.contentType = contentType;
		this.correlationId = correlationId;
		this.applicationProperties = Collections.unmodifiableMap(new LinkedHashMap<>(applicationProperties));
	}

	public JsonNode getBody() {
		return body;
	}

	/**
	 * The body text before any JSON parsing, or null when not exposed.
	 * 
	 * @return
	 */
	public String getRawBody() {
		return rawBody;
	}

	public String getMessageId() {
		return messageId;
	}

	/**
	 * ISO-8601 UTC time the provider enqueued the message, or an empty string.
	 * 
	 * @return
	 */
	public String getEnqueuedTime() {
		return enqueuedTime;
	}

	/**
	 * Decimal text of the sequence number so that values beyond 2^53 survive
	 * JSON consumers.
	 * 
	 * @return
	 */
	public String getSequenceNumber() {
		return sequenceNumber;
	}

	public String getContentType() {
		return contentType;
	}

	public String getCorrelationId() {
		return correlationId;
	}

	public Map<String, Object> getApplicationProperties() {
		return applicationProperties;
	}

	@Override
	public int hashCode() {
		return Objects.hash(applicationProperties, body, contentType, correlationId, enqueuedTime, messageId,
				rawBody, sequenceNumber);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof NormalizedMessage)) {
			return false;
		}
		NormalizedMessage other = (NormalizedMessage) obj;
		return Objects.equals(applicationProperties, other.applicationProperties)
				&& Objects.equals(body, other.body) && Objects.equals(contentType, other.contentType)
				&& Objects.equals(correlationId, other.correlationId)
				&& Objects.equals(enqueuedTime, other.enqueuedTime) && Objects.equals(messageId, other.messageId)
				&& Objects.equals(rawBody, other.rawBody) && Objects.equals(sequenceNumber, other.sequenceNumber);
	}

	@Override
	public String toString() {
		return "NormalizedMessage [messageId=" + messageId + ", sequenceNumber=" + sequenceNumber
				+ ", enqueuedTime=" + enqueuedTime + ", contentType=" + contentType + "]";
	}

}
