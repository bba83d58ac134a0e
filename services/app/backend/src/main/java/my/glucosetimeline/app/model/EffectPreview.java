package my.glucosetimeline.app.model;

import java.util.List;

/**
 * Curve of a single insulin dose or meal from its start until its profile's duration.
 */
public record EffectPreview(String sourceId,
							EffectCategory category,
							KineticProfile profile,
							boolean fallbackProfile,
							double peakMagnitude,
							List<CurvePoint> points,
							List<TimelineWarning> warnings) {
	public EffectPreview {
		points = points == null ? List.of() : List.copyOf(points);
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}
}
