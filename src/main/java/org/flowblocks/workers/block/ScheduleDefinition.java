package org.flowblocks.workers.block;

import java.util.concurrent.TimeUnit;

/**
 * A fixed frequency schedule. The interval and unit can be changed by an
 * operator.
 *
 */
public class ScheduleDefinition {

	public static final long DEFAULT_INTERVAL = 30;
	public static final TimeUnit DEFAULT_UNIT = TimeUnit.SECONDS;

	long interval = DEFAULT_INTERVAL;
	TimeUnit unit = DEFAULT_UNIT;

	public ScheduleDefinition() {
	}

	public ScheduleDefinition(long interval, TimeUnit unit) {
		this.interval = interval;
		this.unit = unit;
	}

	public long getInterval() {
		return interval;
	}

	public void setInterval(long interval) {
		this.interval = interval;
	}

	public TimeUnit getUnit() {
		return unit;
	}

	public void setUnit(TimeUnit unit) {
		this.unit = unit;
	}

	/**
	 * @throws IllegalArgumentException
	 */
	public void validate() {
		if (interval < 1) {
			throw new IllegalArgumentException("Schedule interval must be at least one but was: " + interval);
		}
		if (unit == null) {
			throw new IllegalArgumentException("Schedule unit cannot be null");
		}
	}

	@Override
	public String toString() {
		return "every " + interval + " " + (unit == null ? null : unit.name().toLowerCase());
	}
}
