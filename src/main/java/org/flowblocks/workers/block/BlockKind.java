package org.flowblocks.workers.block;

/**
 * Every kind of block this library provides, each bound to its
 * implementation.
 *
 */
public enum BlockKind {

	QUEUE_READER("Service Bus Queue Reader",
			"Reads messages from a queue on demand. When triggered, receives and completes a pending message.") {
		@Override
		public Block create(BlockContext context) {
			return new QueueReaderBlock(context);
		}
	},
	QUEUE_SUBSCRIPTION("Service Bus Subscription",
			"Subscribes to a queue and polls for messages on a schedule.") {
		@Override
		public Block create(BlockContext context) {
			return new QueueSubscriptionBlock(context);
		}
	};

	private final String displayName;
	private final String description;

	BlockKind(String displayName, String description) {
		this.displayName = displayName;
		this.description = description;
	}

	public String getDisplayName() {
		return displayName;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * Create a new block instance of this kind.
	 * 
	 * @param context
	 * @return
	 */
	public abstract Block create(BlockContext context);
}
