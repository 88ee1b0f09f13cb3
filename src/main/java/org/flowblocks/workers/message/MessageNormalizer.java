package org.flowblocks.workers.message;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Converts a {@link QueueMessage} into a {@link NormalizedMessage}.
 * <p>
 * Normalization never fails. The body is decoded to text (UTF-8 for binary
 * bodies, JSON for structured ones) and then parsed as JSON. When the text is
 * not a single valid JSON value the text itself becomes the body. Absent
 * metadata becomes an empty string or an empty map.
 *
 */
public class MessageNormalizer {

	private final ObjectMapper objectMapper;
	private final boolean includeRawBody;

	/**
	 * @param includeRawBody When true each normalized message carries the
	 *                       pre-parse body text.
	 */
	public MessageNormalizer(boolean includeRawBody) {
		this(new ObjectMapper(), includeRawBody);
	}

	public MessageNormalizer(ObjectMapper objectMapper, boolean includeRawBody) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper cannot be null");
		}
		this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
		this.includeRawBody = includeRawBody;
	}

	/**
	 * Normalize a single raw message.
	 * 
	 * @param raw
	 * @return
	 */
	public NormalizedMessage normalize(QueueMessage raw) {
		String rawBody = decodeBody(raw.getBody());
		JsonNode body = parseBody(rawBody);
		return new NormalizedMessage(body,
				includeRawBody ? rawBody : null,
				emptyIfNull(raw.getMessageId()),
				raw.getEnqueuedTime() == null ? "" : Timestamps.format(raw.getEnqueuedTime()),
				raw.getSequenceNumber() == null ? "" : raw.getSequenceNumber().toString(),
				emptyIfNull(raw.getContentType()),
				emptyIfNull(raw.getCorrelationId()),
				raw.getApplicationProperties() == null ? Collections.<String, Object>emptyMap()
						: raw.getApplicationProperties());
	}

	public boolean isIncludeRawBody() {
		return includeRawBody;
	}

	/**
	 * Decode the provider body into text.
	 * 
	 * @param body
	 * @return
	 */
	String decodeBody(Object body) {
		if (body == null) {
			return "";
		}
		if (body instanceof String) {
			return (String) body;
		}
		if (body instanceof byte[]) {
			return new String((byte[]) body, StandardCharsets.UTF_8);
		}
		if (body instanceof ByteBuffer) {
			return StandardCharsets.UTF_8.decode(((ByteBuffer) body).duplicate()).toString();
		}
		try {
			return objectMapper.writeValueAsString(body);
		} catch (JsonProcessingException e) {
			// not representable as JSON so fall back to the object's own text.
			return String.valueOf(body);
		}
	}

	/**
	 * Parse the text as a single JSON value, or wrap the text itself.
	 * 
	 * @param text
	 * @return
	 */
	JsonNode parseBody(String text) {
		try {
			JsonNode node = objectMapper.readTree(text);
			if (node == null || node.isMissingNode()) {
				return TextNode.valueOf(text);
			}
			return node;
		} catch (JsonProcessingException e) {
			return TextNode.valueOf(text);
		}
	}

	private static String emptyIfNull(String value) {
		return value == null ? "" : value;
	}
}
