package org.flowblocks.workers.lifecycle;

/**
 * The operator facing view of a block's health. Receives every health change.
 *
 */
@FunctionalInterface
public interface HealthStatusSurface {

	void publish(BlockHealth health);

}
