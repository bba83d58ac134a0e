package my.glucosetimeline.app.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Reconstruction grid: points fall on {@code start + k * intervalMinutes} up to and including {@code end}.
 */
public record TimeWindow(Instant start, Instant end, int intervalMinutes) {
	public static final int DEFAULT_INTERVAL_MINUTES = 15;
	public static final int PREVIEW_INTERVAL_MINUTES = 5;

	public TimeWindow {
		if (start == null || end == null) {
			throw new TimelineConfigurationException("window", "Window start and end are required");
		}
		if (end.isBefore(start)) {
			throw new TimelineConfigurationException("window", "Window end " + end + " precedes start " + start);
		}
		if (intervalMinutes <= 0) {
			throw new TimelineConfigurationException("intervalMinutes", "Interval must be positive, was " + intervalMinutes);
		}
	}

	public Duration interval() {
		return Duration.ofMinutes(intervalMinutes);
	}

	public boolean contains(Instant timestamp) {
		return timestamp != null && !timestamp.isBefore(start) && !timestamp.isAfter(end);
	}
}
