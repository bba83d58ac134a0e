package my.glucosetimeline.app.model;

import my.glucosetimeline.app.domain.ReadingSource;

import java.time.Instant;
import java.util.Map;

/**
 * One point of the reconstructed timeline.
 *
 * @param value                     displayed glucose: the reading for actual points, the baseline for historical
 *                                  estimates, the projection with effect overlays otherwise
 * @param baselineValue             drift-to-target estimate without meal or insulin overlays
 * @param projectedValue            estimate including overlays
 * @param perSourceContributions    signed glucose impact per meal or insulin source id; sums to {@code netEffect}
 * @param insulinNeedsFactor        combined activity and medication multiplier dividing insulin impact
 * @param connectedToPrevious       true when this actual reading continues a segment with the previous one
 * @param source                    reading origin, null for estimated points
 */
public record TimelinePoint(Instant timestamp,
							double value,
							PointClassification classification,
							boolean historical,
							double baselineValue,
							double projectedValue,
							Map<String, Double> perSourceContributions,
							double totalInsulinActive,
							double totalCarbEquivalentActive,
							double insulinNeedsFactor,
							double netEffect,
							GlucoseStatus status,
							boolean connectedToPrevious,
							ReadingSource source) {
	public TimelinePoint {
		perSourceContributions = perSourceContributions == null ? Map.of() : Map.copyOf(perSourceContributions);
	}

	public boolean isActual() {
		return classification == PointClassification.ACTUAL;
	}
}
