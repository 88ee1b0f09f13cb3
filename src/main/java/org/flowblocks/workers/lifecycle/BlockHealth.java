package org.flowblocks.workers.lifecycle;

import java.util.Objects;

/**
 * The health of a block as shown to operators: a status plus an optional
 * description of why it failed.
 *
 */
public class BlockHealth {

	private final HealthStatus status;
	private final String description;

	public BlockHealth(HealthStatus status, String description) {
		if (status == null) {
			throw new IllegalArgumentException("Status cannot be null");
		}
		this.status = status;
		this.description = description;
	}

	public static BlockHealth ready() {
		return new BlockHealth(HealthStatus.READY, null);
	}

	public static BlockHealth failed(String description) {
		return new BlockHealth(HealthStatus.FAILED, description);
	}

	public static BlockHealth drained() {
		return new BlockHealth(HealthStatus.DRAINED, null);
	}

	public HealthStatus getStatus() {
		return status;
	}

	/**
	 * @return The failure description, or null.
	 */
	public String getDescription() {
		return description;
	}

	@Override
	public int hashCode() {
		return Objects.hash(description, status);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof BlockHealth)) {
			return false;
		}
		BlockHealth other = (BlockHealth) obj;
		return Objects.equals(description, other.description) && status == other.status;
	}

	@Override
	public String toString() {
		return description == null ? status.name() : status.name() + " (" + description + ")";
	}
}
