package org.flowblocks.workers.poll;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.flowblocks.workers.message.NormalizedMessage;

/**
 * The outcome of one poll cycle. Callers must check {@link #getOutcome()}
 * because a failed cycle is reported here rather than thrown.
 *
 */
public class PollCycleResult {

	private final int receivedCount;
	private final List<NormalizedMessage> messages;
	private final PollOutcome outcome;
	private final ErrorKind errorKind;
	private final String diagnostic;
	private final List<String> warnings;

	private PollCycleResult(int receivedCount, List<NormalizedMessage> messages, PollOutcome outcome,
			ErrorKind errorKind, String diagnostic, List<String> warnings) {
		this.receivedCount = receivedCount;
		this.messages = Collections.unmodifiableList(new ArrayList<>(messages));
		this.outcome = outcome;
		this.errorKind = errorKind;
		this.diagnostic = diagnostic;
		this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
	}

	public static PollCycleResult ok(int receivedCount, List<NormalizedMessage> messages, List<String> warnings) {
		return new PollCycleResult(receivedCount, messages, PollOutcome.OK, null, null, warnings);
	}

	public static PollCycleResult error(int receivedCount, List<NormalizedMessage> messages, ErrorKind errorKind,
			String diagnostic, List<String> warnings) {
		return new PollCycleResult(receivedCount, messages, PollOutcome.ERROR, errorKind, diagnostic, warnings);
	}

	/**
	 * Number of messages the provider handed to this cycle.
	 * 
	 * @return
	 */
	public int getReceivedCount() {
		return receivedCount;
	}

	/**
	 * The messages that were acknowledged and emitted, in receipt order.
	 * 
	 * @return
	 */
	public List<NormalizedMessage> getMessages() {
		return messages;
	}

	public PollOutcome getOutcome() {
		return outcome;
	}

	public boolean isOk() {
		return outcome == PollOutcome.OK;
	}

	/**
	 * @return null when the outcome is {@link PollOutcome#OK}.
	 */
	public ErrorKind getErrorKind() {
		return errorKind;
	}

	/**
	 * @return null when the outcome is {@link PollOutcome#OK}.
	 */
	public String getDiagnostic() {
		return diagnostic;
	}

	public List<String> getWarnings() {
		return warnings;
	}

	@Override
	public String toString() {
		return "PollCycleResult [receivedCount=" + receivedCount + ", emitted=" + messages.size() + ", outcome="
				+ outcome + ", errorKind=" + errorKind + ", diagnostic=" + diagnostic + "]";
	}
}
