package org.flowblocks.workers;

/**
 * Decides whether a scheduled trigger may run and is told when one fails.
 *
 */
public interface Gate {

	/**
	 * @return True if the trigger may run now.
	 */
	boolean canRun();

	/**
	 * Called when a trigger that passed the gate failed with an unhandled error.
	 *
	 * @param error
	 */
	void runFailed(Exception error);

}
