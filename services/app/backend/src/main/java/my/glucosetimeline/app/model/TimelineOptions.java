package my.glucosetimeline.app.model;

import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Gap-fill and projection settings for one reconstruction.
 *
 * @param zoneId zone in which medication daily dose times are interpreted
 */
public record TimelineOptions(boolean gapFillEnabled,
							  boolean fillFromStart,
							  ExtensionMode extensionMode,
							  boolean returnToTarget,
							  int maxConnectGapMinutes,
							  double stabilizationHours,
							  double safetyFloor,
							  ZoneId zoneId) {
	public static final int DEFAULT_MAX_CONNECT_GAP_MINUTES = 20;
	public static final double DEFAULT_STABILIZATION_HOURS = 2.0d;
	public static final double DEFAULT_SAFETY_FLOOR = 40.0d;

	public TimelineOptions {
		if (extensionMode == null) {
			extensionMode = ExtensionMode.TO_WINDOW_END;
		}
		if (zoneId == null) {
			zoneId = ZoneOffset.UTC;
		}
	}

	public static TimelineOptions defaults() {
		return new TimelineOptions(true, true, ExtensionMode.TO_WINDOW_END, false,
				DEFAULT_MAX_CONNECT_GAP_MINUTES, DEFAULT_STABILIZATION_HOURS, DEFAULT_SAFETY_FLOOR, ZoneOffset.UTC);
	}

	public void validate() {
		if (!Double.isFinite(stabilizationHours) || stabilizationHours <= 0) {
			throw new TimelineConfigurationException("stabilizationHours", "Stabilization hours must be positive");
		}
		if (maxConnectGapMinutes < 0) {
			throw new TimelineConfigurationException("maxConnectGapMinutes", "Connect gap must not be negative");
		}
		if (!Double.isFinite(safetyFloor)) {
			throw new TimelineConfigurationException("safetyFloor", "Safety floor must be finite");
		}
	}

	public TimelineOptions withGapFillEnabled(boolean value) {
		return new TimelineOptions(value, fillFromStart, extensionMode, returnToTarget, maxConnectGapMinutes,
				stabilizationHours, safetyFloor, zoneId);
	}

	public TimelineOptions withExtensionMode(ExtensionMode value) {
		return new TimelineOptions(gapFillEnabled, fillFromStart, value, returnToTarget, maxConnectGapMinutes,
				stabilizationHours, safetyFloor, zoneId);
	}

	public TimelineOptions withFillFromStart(boolean value) {
		return new TimelineOptions(gapFillEnabled, value, extensionMode, returnToTarget, maxConnectGapMinutes,
				stabilizationHours, safetyFloor, zoneId);
	}

	public TimelineOptions withReturnToTarget(boolean value) {
		return new TimelineOptions(gapFillEnabled, fillFromStart, extensionMode, value, maxConnectGapMinutes,
				stabilizationHours, safetyFloor, zoneId);
	}
}
