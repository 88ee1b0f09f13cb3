package org.flowblocks.workers;

/**
 * Abstraction over the system time so that timestamps recorded by a worker
 * can be controlled in tests.
 *
 */
public interface Clock {

	/**
	 * Get the current system time in MS.
	 * @return
	 */
	long currentTimeMillis();

}
