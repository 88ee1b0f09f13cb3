package org.flowblocks.workers.poll;

public enum PollOutcome {
	OK, ERROR
}
