package my.glucosetimeline.app.domain;

import my.glucosetimeline.app.model.EffectCategory;

import java.time.Instant;

/**
 * A time-stamped physiological effect source. Implementations are immutable snapshots supplied per invocation.
 */
public sealed interface EffectSource permits InsulinDose, MealRecord, ActivityRecord, MedicationCourse {
	String id();

	EffectCategory category();

	/**
	 * Moment from which elapsed time is measured. Medication courses return the start of their schedule.
	 */
	Instant startsAt();
}
