package my.glucosetimeline.app.service;

import my.glucosetimeline.app.model.PatientConstants;
import org.springframework.stereotype.Component;

/**
 * Additive glucose model: exponential drift from an anchor value toward target, plus carbohydrate impact,
 * minus insulin impact, clamped at a safety floor. Not a clinical predictor.
 */
@Component
public class GlucoseProjectionModel {
	private static final double DECAY_RATE = 3.0d;
	private static final double MIN_INSULIN_NEEDS_FACTOR = 0.1d;

	public double naturalValue(double baseValue, double elapsedMinutes, double targetGlucose, double stabilizationHours) {
		double elapsed = Math.max(0.0d, elapsedMinutes);
		double windowMinutes = stabilizationHours * 60.0d;
		return targetGlucose + (baseValue - targetGlucose) * Math.exp(-DECAY_RATE * elapsed / windowMinutes);
	}

	public double baselineValue(double baseValue, double elapsedMinutes, double targetGlucose,
								double stabilizationHours, double safetyFloor) {
		return Math.max(safetyFloor, naturalValue(baseValue, elapsedMinutes, targetGlucose, stabilizationHours));
	}

	public double carbImpact(double activeCarbEquivalent, PatientConstants constants) {
		return Math.max(0.0d, activeCarbEquivalent) * constants.carbToBgFactor();
	}

	/**
	 * Glucose lowered by the active insulin. A needs factor above 1.0 (resistance) weakens it, below 1.0 strengthens it.
	 */
	public double insulinImpact(double activeInsulin, PatientConstants constants, double insulinNeedsFactor) {
		double needs = Math.max(MIN_INSULIN_NEEDS_FACTOR, insulinNeedsFactor);
		return Math.max(0.0d, activeInsulin) * constants.insulinSensitivityFactor() / needs;
	}

	public double projectGlucose(double baseValue, double elapsedMinutes, double targetGlucose, double activeInsulin,
								 double activeCarbEquivalent, double stabilizationHours, PatientConstants constants,
								 double insulinNeedsFactor, double safetyFloor) {
		double natural = naturalValue(baseValue, elapsedMinutes, targetGlucose, stabilizationHours);
		double projected = natural
				+ carbImpact(activeCarbEquivalent, constants)
				- insulinImpact(activeInsulin, constants, insulinNeedsFactor);
		return Math.max(safetyFloor, projected);
	}
}
