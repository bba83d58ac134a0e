package my.glucosetimeline.app.model;

import java.time.Instant;

/**
 * Insulin-needs factor of a medication course at a moment, with the phase it is in.
 */
public record MedicationEffect(double factor, MedicationPhase phase, Instant lastDose, Double hoursSinceLastDose) {
	public static MedicationEffect inactive(MedicationPhase phase) {
		return new MedicationEffect(1.0d, phase, null, null);
	}

	public boolean isActive() {
		return phase == MedicationPhase.RAMPING_UP || phase == MedicationPhase.PEAK
				|| phase == MedicationPhase.TAPERING || phase == MedicationPhase.CONSTANT;
	}
}
