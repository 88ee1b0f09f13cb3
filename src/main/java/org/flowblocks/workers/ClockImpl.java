package org.flowblocks.workers;

/**
 * Simple implementation of a Clock.
 *
 */
public class ClockImpl implements Clock {

	/*
	 * (non-Javadoc)
	 * @see org.flowblocks.workers.Clock#currentTimeMillis()
	 */
	@Override
	public long currentTimeMillis() {
		return System.currentTimeMillis();
	}

}
