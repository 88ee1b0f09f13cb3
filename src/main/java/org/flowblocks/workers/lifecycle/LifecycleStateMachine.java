package org.flowblocks.workers.lifecycle;

import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flowblocks.workers.Gate;
import org.flowblocks.workers.health.ProbeResult;
import org.flowblocks.workers.poll.ErrorKind;
import org.flowblocks.workers.poll.PollCycleResult;
import org.flowblocks.workers.state.ConsumerStateTracker;

/**
 * Tracks the health of one block instance.
 * <p>
 * The status only ever changes in response to a synchronous connection probe
 * or a drain request:
 * <ul>
 * <li>activation probe: success is READY, failure is FAILED</li>
 * <li>READY and a probe fails: FAILED</li>
 * <li>FAILED and a probe succeeds: READY</li>
 * <li>READY or FAILED and drain is requested: DRAINED, which is terminal and
 * clears the consumer state</li>
 * </ul>
 * A failed poll cycle never changes the status by itself. It requests a
 * re-probe and the probe's verdict decides, so a single transient provider
 * error does not flap the displayed health. Configuration failures mark the
 * block FAILED without a probe and are not re-probed automatically; only a new
 * {@link #activate()} re-validates them.
 * <p>
 * Before {@link #activate()} the status is null and the gate is closed.
 *
 */
public class LifecycleStateMachine implements Gate {

	private static final Logger log = LogManager.getLogger(LifecycleStateMachine.class);

	private final Supplier<ProbeResult> probe;
	private final ConsumerStateTracker stateTracker;
	private final HealthStatusSurface surface;

	private BlockHealth health;
	private boolean autoRecoverable = true;

	/**
	 * @param probe        Runs a synchronous connection probe.
	 * @param stateTracker Cleared when the block is drained.
	 * @param surface      Optional, receives every health change.
	 */
	public LifecycleStateMachine(Supplier<ProbeResult> probe, ConsumerStateTracker stateTracker,
			HealthStatusSurface surface) {
		if (probe == null) {
			throw new IllegalArgumentException("Probe cannot be null");
		}
		if (stateTracker == null) {
			throw new IllegalArgumentException("ConsumerStateTracker cannot be null");
		}
		this.probe = probe;
		this.stateTracker = stateTracker;
		this.surface = surface;
	}

	/**
	 * The current health or null if the block was never activated.
	 * 
	 * @return
	 */
	public synchronized BlockHealth getHealth() {
		return health;
	}

	public synchronized HealthStatus getStatus() {
		return health == null ? null : health.getStatus();
	}

	/**
	 * Run the activation probe and set the initial status. Also used to
	 * re-validate a block that failed on its configuration.
	 * 
	 * @return
	 */
	public synchronized BlockHealth activate() {
		if (isDrained()) {
			log.info("Ignoring activation of a drained block");
			return health;
		}
		return applyProbe(probe.get());
	}

	/**
	 * Run a probe and converge the status to its verdict.
	 * 
	 * @return
	 */
	public synchronized BlockHealth reprobe() {
		if (isDrained()) {
			return health;
		}
		log.info("Re-probing block currently " + health);
		return applyProbe(probe.get());
	}

	/**
	 * Apply the verdict of a probe to the current status.
	 * 
	 * @param result
	 * @return
	 */
	public synchronized BlockHealth applyProbe(ProbeResult result) {
		if (isDrained()) {
			log.info("Ignoring probe result for a drained block: " + result);
			return health;
		}
		if (result.isSuccess()) {
			autoRecoverable = true;
			transition(BlockHealth.ready());
		} else {
			autoRecoverable = result.getErrorKind() != ErrorKind.CONFIGURATION;
			transition(BlockHealth.failed(result.getDescription()));
		}
		return health;
	}

	/**
	 * React to the outcome of a poll cycle. A successful cycle changes nothing.
	 * A configuration failure marks the block FAILED. Any other failure
	 * triggers a re-probe.
	 * 
	 * @param result
	 * @return
	 */
	public synchronized BlockHealth onPollResult(PollCycleResult result) {
		if (result.isOk() || isDrained()) {
			return health;
		}
		if (result.getErrorKind() == ErrorKind.CONFIGURATION) {
			autoRecoverable = false;
			transition(BlockHealth.failed(result.getDiagnostic()));
			return health;
		}
		return reprobe();
	}

	/**
	 * Should a scheduled trigger try to recover this block with a probe?
	 * 
	 * @return
	 */
	public synchronized boolean shouldReprobe() {
		return health != null && health.getStatus() == HealthStatus.FAILED && autoRecoverable;
	}

	/**
	 * Drain the block. Terminal; the consumer state is removed.
	 * 
	 * @return
	 */
	public synchronized BlockHealth drain() {
		if (isDrained()) {
			return health;
		}
		stateTracker.clear();
		transition(BlockHealth.drained());
		return health;
	}

	/**
	 * Scheduled triggers may run until the block is drained.
	 */
	@Override
	public synchronized boolean canRun() {
		return health != null && !isDrained();
	}

	@Override
	public void runFailed(Exception error) {
		log.error("Scheduled trigger failed: " + error.getMessage(), error);
		reprobe();
	}

	private boolean isDrained() {
		return health != null && health.getStatus() == HealthStatus.DRAINED;
	}

	private void transition(BlockHealth next) {
		if (next.equals(health)) {
			return;
		}
		log.info("Block health changed from " + health + " to " + next);
		health = next;
		if (surface != null) {
			surface.publish(next);
		}
	}
}
