package my.glucosetimeline.app.model;

import java.time.Instant;
import java.util.Map;

public record TimelineSummary(Instant at,
							  double totalActiveInsulin,
							  double totalCarbEquivalent,
							  double insulinNeedsFactor,
							  Map<String, Double> activeInsulinById,
							  Map<String, Double> carbEquivalentById,
							  Map<String, Double> multiplierById,
							  int actualPoints,
							  int anchorPoints,
							  int estimatedPoints) {
	public TimelineSummary {
		activeInsulinById = activeInsulinById == null ? Map.of() : Map.copyOf(activeInsulinById);
		carbEquivalentById = carbEquivalentById == null ? Map.of() : Map.copyOf(carbEquivalentById);
		multiplierById = multiplierById == null ? Map.of() : Map.copyOf(multiplierById);
	}
}
