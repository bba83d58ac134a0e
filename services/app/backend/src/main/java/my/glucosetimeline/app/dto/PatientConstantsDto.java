package my.glucosetimeline.app.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.Map;

/**
 * Per-request patient constants. Absent values fall back to the configured defaults.
 */
public record PatientConstantsDto(@Positive Double targetGlucose,
								  @Positive Double correctionFactor,
								  @Positive Double insulinSensitivityFactor,
								  @PositiveOrZero Double carbToBgFactor,
								  @PositiveOrZero Double proteinFactor,
								  @PositiveOrZero Double fatFactor,
								  @PositiveOrZero Double fiberFactor,
								  Map<String, Double> absorptionModifiers,
								  Map<Integer, Double> activityCoefficients,
								  Map<String, KineticProfileDto> medicationFactors) {
}
