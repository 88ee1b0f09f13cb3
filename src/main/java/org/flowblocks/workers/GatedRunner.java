package org.flowblocks.workers;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a scheduled trigger only while its {@link Gate} is open.
 * <p>
 * A closed gate turns the run into a no-op. An exception escaping the trigger
 * is handed to {@link Gate#runFailed(Exception)} and does not propagate, so
 * the scheduler keeps the task scheduled.
 *
 */
public class GatedRunner implements Runnable {

	private static final Logger log = LogManager.getLogger(GatedRunner.class);

	private final Gate gate;
	private final Runnable trigger;

	public GatedRunner(Gate gate, Runnable trigger) {
		if (gate == null) {
			throw new IllegalArgumentException("Gate cannot be null");
		}
		if (trigger == null) {
			throw new IllegalArgumentException("Trigger cannot be null");
		}
		this.gate = gate;
		this.trigger = trigger;
	}

	@Override
	public void run() {
		if (!gate.canRun()) {
			log.debug("Gate is closed, skipping trigger");
			return;
		}
		try {
			trigger.run();
		} catch (Exception e) {
			gate.runFailed(e);
		}
	}

}
