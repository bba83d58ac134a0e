package my.glucosetimeline.app.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Patient-specific weighting factors supplied by the caller.
 *
 * @param medicationFactors kinetic profiles keyed by insulin or medication id; they take precedence over the catalog
 */
public record PatientConstants(double targetGlucose,
							   double correctionFactor,
							   double insulinSensitivityFactor,
							   double carbToBgFactor,
							   double proteinFactor,
							   double fatFactor,
							   double fiberFactor,
							   Map<AbsorptionClass, Double> absorptionModifiers,
							   Map<Integer, Double> activityCoefficients,
							   Map<String, KineticProfile> medicationFactors) {
	public static final Map<Integer, Double> DEFAULT_ACTIVITY_COEFFICIENTS = Map.of(
			-2, 0.2d,
			-1, 0.1d,
			0, 0.0d,
			1, -0.1d,
			2, -0.2d
	);

	public PatientConstants {
		absorptionModifiers = absorptionModifiers == null ? Map.of() : Map.copyOf(absorptionModifiers);
		activityCoefficients = activityCoefficients == null ? DEFAULT_ACTIVITY_COEFFICIENTS : Map.copyOf(activityCoefficients);
		medicationFactors = medicationFactors == null ? Map.of() : Map.copyOf(medicationFactors);
	}

	public static PatientConstants defaults() {
		return new PatientConstants(100.0d, 50.0d, 50.0d, 4.0d, 0.5d, 0.2d, 0.1d,
				defaultAbsorptionModifiers(), DEFAULT_ACTIVITY_COEFFICIENTS, Map.of());
	}

	public static Map<AbsorptionClass, Double> defaultAbsorptionModifiers() {
		Map<AbsorptionClass, Double> modifiers = new EnumMap<>(AbsorptionClass.class);
		for (AbsorptionClass absorptionClass : AbsorptionClass.values()) {
			modifiers.put(absorptionClass, absorptionClass.defaultModifier());
		}
		return modifiers;
	}

	public double absorptionModifier(AbsorptionClass absorptionClass) {
		AbsorptionClass key = absorptionClass == null ? AbsorptionClass.MEDIUM : absorptionClass;
		Double modifier = absorptionModifiers.get(key);
		if (modifier == null || !Double.isFinite(modifier) || modifier <= 0) {
			return key.defaultModifier();
		}
		return modifier;
	}

	public double activityCoefficient(int level) {
		Double coefficient = activityCoefficients.get(level);
		if (coefficient == null || !Double.isFinite(coefficient)) {
			return 0.0d;
		}
		return coefficient;
	}

	public PatientConstants withMedicationFactors(Map<String, KineticProfile> value) {
		return new PatientConstants(targetGlucose, correctionFactor, insulinSensitivityFactor, carbToBgFactor, proteinFactor,
				fatFactor, fiberFactor, absorptionModifiers, activityCoefficients, value);
	}
}
