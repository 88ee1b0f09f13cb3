package org.flowblocks.workers.message;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * ISO-8601 formatting shared by message normalization and consumer state.
 * Timestamps are always UTC with millisecond precision, for example
 * <code>2024-03-01T12:30:00.000Z</code>.
 *
 */
public final class Timestamps {

	private static final DateTimeFormatter ISO_MILLIS = DateTimeFormatter
			.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

	private Timestamps() {
	}

	public static String format(Instant instant) {
		return ISO_MILLIS.format(instant);
	}

	public static String format(long epochMillis) {
		return format(Instant.ofEpochMilli(epochMillis));
	}

	public static Instant parse(String isoText) {
		return Instant.parse(isoText);
	}
}
