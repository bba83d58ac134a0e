package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.domain.MedicationCourse;
import my.glucosetimeline.app.domain.MedicationSchedule;
import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.MedicationEffect;
import my.glucosetimeline.app.model.MedicationPhase;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Insulin-needs factor of a chronic medication course, gated by its schedule.
 * <p>
 * Duration-based medications ramp from 1.0 to the steady-state factor until onset, hold it until the peak,
 * then taper back to 1.0 by the duration, all measured from the latest daily dose. Other medications apply
 * their factor unchanged while the course is active.
 */
public final class MedicationFactorCurve {
	private static final Duration DEFAULT_DOSE_LOOKBACK = Duration.ofHours(24);

	private MedicationFactorCurve() {
	}

	public static MedicationEffect effectAt(MedicationCourse course, KineticProfile profile, Instant at, ZoneId zoneId) {
		MedicationSchedule schedule = course.schedule();
		if (schedule == null || schedule.startDate() == null || at == null) {
			return MedicationEffect.inactive(MedicationPhase.NO_EFFECT);
		}
		LocalDate day = at.atZone(zoneId).toLocalDate();
		if (day.isBefore(schedule.startDate())) {
			return MedicationEffect.inactive(MedicationPhase.NOT_STARTED);
		}
		if (schedule.endDate() != null && day.isAfter(schedule.endDate())) {
			return MedicationEffect.inactive(MedicationPhase.ENDED);
		}
		double steadyFactor = steadyFactor(course, profile);
		if (!profile.durationBased()) {
			return new MedicationEffect(steadyFactor, MedicationPhase.CONSTANT, null, null);
		}

		Instant lastDose = findLastDoseTime(schedule, at, zoneId);
		double hoursSince = EffectCurves.hoursBetween(lastDose, at);
		double onset = profile.onsetHours();
		double peak = profile.riseEndHours();
		double duration = profile.durationHours();
		if (hoursSince < onset) {
			double factor = 1.0d + (steadyFactor - 1.0d) * (hoursSince / onset);
			return new MedicationEffect(factor, MedicationPhase.RAMPING_UP, lastDose, hoursSince);
		}
		if (hoursSince < peak) {
			return new MedicationEffect(steadyFactor, MedicationPhase.PEAK, lastDose, hoursSince);
		}
		if (hoursSince < duration) {
			double remaining = (duration - hoursSince) / (duration - peak);
			double factor = 1.0d + (steadyFactor - 1.0d) * remaining;
			return new MedicationEffect(factor, MedicationPhase.TAPERING, lastDose, hoursSince);
		}
		return new MedicationEffect(1.0d, MedicationPhase.NO_EFFECT, lastDose, hoursSince);
	}

	public static double steadyFactor(MedicationCourse course, KineticProfile profile) {
		Double factor = course.factor();
		if (factor != null && Double.isFinite(factor) && factor > 0) {
			return factor;
		}
		return profile.defaultFactor();
	}

	/**
	 * Latest scheduled dose at or before {@code at}: each daily time is taken on the same day, or the day
	 * before when it lies in the future. Without daily times the dose is assumed 24 hours ago.
	 */
	public static Instant findLastDoseTime(MedicationSchedule schedule, Instant at, ZoneId zoneId) {
		if (schedule.dailyTimes().isEmpty()) {
			return at.minus(DEFAULT_DOSE_LOOKBACK);
		}
		ZonedDateTime current = at.atZone(zoneId);
		Instant latest = null;
		for (LocalTime time : schedule.dailyTimes()) {
			ZonedDateTime dose = current.toLocalDate().atTime(time).atZone(zoneId);
			if (dose.isAfter(current)) {
				dose = dose.minusDays(1);
			}
			Instant candidate = dose.toInstant();
			if (latest == null || candidate.isAfter(latest)) {
				latest = candidate;
			}
		}
		return latest;
	}
}
