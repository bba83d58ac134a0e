package my.glucosetimeline.app.domain;

import my.glucosetimeline.app.model.EffectCategory;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * A chronic medication taken on a schedule. {@code factor} is the steady-state insulin-needs multiplier;
 * when null the catalog factor for {@code medicationId} applies.
 */
public record MedicationCourse(String id,
							   String medicationId,
							   Double factor,
							   MedicationSchedule schedule) implements EffectSource {
	@Override
	public EffectCategory category() {
		return EffectCategory.MEDICATION;
	}

	/**
	 * Start of the course's first day in UTC. Dose timing uses the schedule and the configured zone instead.
	 */
	@Override
	public Instant startsAt() {
		if (schedule == null || schedule.startDate() == null) {
			return null;
		}
		return schedule.startDate().atStartOfDay().toInstant(ZoneOffset.UTC);
	}
}
