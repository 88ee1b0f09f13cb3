package org.flowblocks.workers.session;

/**
 * The queue providers a session can be opened against, with the largest batch
 * each one accepts for a single receive.
 *
 */
public enum QueueProvider {

	SERVICE_BUS(2047),
	SQS(10);

	private final int maxBatchSize;

	QueueProvider(int maxBatchSize) {
		this.maxBatchSize = maxBatchSize;
	}

	/**
	 * The hard ceiling on messages per receive call.
	 * 
	 * @return
	 */
	public int getMaxBatchSize() {
		return maxBatchSize;
	}
}
