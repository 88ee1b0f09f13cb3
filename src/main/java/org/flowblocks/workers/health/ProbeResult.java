package org.flowblocks.workers.health;

import org.flowblocks.workers.poll.ErrorKind;

/**
 * Verdict of a connection probe.
 *
 */
public class ProbeResult {

	private static final ProbeResult SUCCESS = new ProbeResult(true, null, null);

	private final boolean success;
	private final ErrorKind errorKind;
	private final String description;

	private ProbeResult(boolean success, ErrorKind errorKind, String description) {
		this.success = success;
		this.errorKind = errorKind;
		this.description = description;
	}

	public static ProbeResult success() {
		return SUCCESS;
	}

	public static ProbeResult failure(ErrorKind errorKind, String description) {
		return new ProbeResult(false, errorKind, description);
	}

	public boolean isSuccess() {
		return success;
	}

	public ErrorKind getErrorKind() {
		return errorKind;
	}

	/**
	 * Human readable reason for a failure. Null on success.
	 * 
	 * @return
	 */
	public String getDescription() {
		return description;
	}

	@Override
	public String toString() {
		return success ? "ProbeResult [success]"
				: "ProbeResult [errorKind=" + errorKind + ", description=" + description + "]";
	}
}
