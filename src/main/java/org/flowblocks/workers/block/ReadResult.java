package org.flowblocks.workers.block;

import org.flowblocks.workers.message.NormalizedMessage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The event a {@link QueueReaderBlock} emits for each input event. Failures
 * are reported as {@link Status#ERROR} with no message rather than thrown.
 *
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({ "status", "checkedAt", "message" })
public class ReadResult {

	public enum Status {
		@JsonProperty("connected")
		CONNECTED,
		@JsonProperty("error")
		ERROR
	}

	private final Status status;
	private final String checkedAt;
	private final NormalizedMessage message;

	public ReadResult(Status status, String checkedAt, NormalizedMessage message) {
		this.status = status;
		this.checkedAt = checkedAt;
		this.message = message;
	}

	public Status getStatus() {
		return status;
	}

	/**
	 * ISO-8601 time the read was started.
	 * 
	 * @return
	 */
	public String getCheckedAt() {
		return checkedAt;
	}

	/**
	 * @return The received message or null if none was available.
	 */
	public NormalizedMessage getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return "ReadResult [status=" + status + ", checkedAt=" + checkedAt + ", message=" + message + "]";
	}
}
