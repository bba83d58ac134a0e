package my.glucosetimeline.app.config;

import my.glucosetimeline.app.model.ExtensionMode;
import my.glucosetimeline.app.model.PatientConstants;
import my.glucosetimeline.app.model.TimeWindow;
import my.glucosetimeline.app.model.TimelineOptions;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * Configured fallbacks for every per-request option and patient constant.
 */
@Component
public class TimelineDefaults {
	private final AppProperties properties;

	public TimelineDefaults(AppProperties properties) {
		this.properties = properties;
	}

	public int intervalMinutes() {
		AppProperties.Timeline timeline = properties.timeline();
		return timeline == null || timeline.intervalMinutes() == null
				? TimeWindow.DEFAULT_INTERVAL_MINUTES
				: timeline.intervalMinutes();
	}

	public int previewIntervalMinutes() {
		AppProperties.Timeline timeline = properties.timeline();
		return timeline == null || timeline.previewIntervalMinutes() == null
				? TimeWindow.PREVIEW_INTERVAL_MINUTES
				: timeline.previewIntervalMinutes();
	}

	public TimelineOptions options() {
		TimelineOptions fallback = TimelineOptions.defaults();
		AppProperties.Timeline timeline = properties.timeline();
		if (timeline == null) {
			return fallback;
		}
		return new TimelineOptions(
				valueOr(timeline.gapFillEnabled(), fallback.gapFillEnabled()),
				valueOr(timeline.fillFromStart(), fallback.fillFromStart()),
				ExtensionMode.from(timeline.extension(), fallback.extensionMode()),
				valueOr(timeline.returnToTarget(), fallback.returnToTarget()),
				valueOr(timeline.maxConnectGapMinutes(), fallback.maxConnectGapMinutes()),
				valueOr(timeline.stabilizationHours(), fallback.stabilizationHours()),
				valueOr(timeline.safetyFloor(), fallback.safetyFloor()),
				timeline.zoneId() == null || timeline.zoneId().isBlank() ? fallback.zoneId() : ZoneId.of(timeline.zoneId())
		);
	}

	public PatientConstants constants() {
		PatientConstants fallback = PatientConstants.defaults();
		AppProperties.PatientDefaults defaults = properties.patientDefaults();
		if (defaults == null) {
			return fallback;
		}
		return new PatientConstants(
				valueOr(defaults.targetGlucose(), fallback.targetGlucose()),
				valueOr(defaults.correctionFactor(), fallback.correctionFactor()),
				valueOr(defaults.insulinSensitivityFactor(), fallback.insulinSensitivityFactor()),
				valueOr(defaults.carbToBgFactor(), fallback.carbToBgFactor()),
				valueOr(defaults.proteinFactor(), fallback.proteinFactor()),
				valueOr(defaults.fatFactor(), fallback.fatFactor()),
				valueOr(defaults.fiberFactor(), fallback.fiberFactor()),
				fallback.absorptionModifiers(),
				fallback.activityCoefficients(),
				fallback.medicationFactors()
		);
	}

	private static <T> T valueOr(T value, T fallback) {
		return value == null ? fallback : value;
	}
}
