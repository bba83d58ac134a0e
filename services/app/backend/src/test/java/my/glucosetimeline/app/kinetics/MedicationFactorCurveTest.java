package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.domain.MedicationCourse;
import my.glucosetimeline.app.domain.MedicationSchedule;
import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.MedicationEffect;
import my.glucosetimeline.app.model.MedicationPhase;
import my.glucosetimeline.app.model.ProfileShape;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MedicationFactorCurveTest {
	private static final ZoneId UTC = ZoneOffset.UTC;
	private static final KineticProfile STEROID = new KineticProfile(4.0d, 8.0d, 24.0d, ProfileShape.TRIANGULAR, true, 1.4d);
	private static final KineticProfile CONSTANT = new KineticProfile(0.0d, null, 0.0d, ProfileShape.PEAKLESS, false, 0.9d);
	private static final MedicationSchedule JANUARY = new MedicationSchedule(
			LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31), List.of(LocalTime.of(8, 0)));

	@Test
	void followsRampPeakAndTaperPhasesAfterDailyDose() {
		MedicationCourse course = new MedicationCourse("pred", "corticosteroids", null, JANUARY);

		MedicationEffect ramping = MedicationFactorCurve.effectAt(course, STEROID, Instant.parse("2026-01-10T10:00:00Z"), UTC);
		MedicationEffect peak = MedicationFactorCurve.effectAt(course, STEROID, Instant.parse("2026-01-10T14:00:00Z"), UTC);
		MedicationEffect tapering = MedicationFactorCurve.effectAt(course, STEROID, Instant.parse("2026-01-11T00:00:00Z"), UTC);

		assertThat(ramping.phase()).isEqualTo(MedicationPhase.RAMPING_UP);
		assertThat(ramping.factor()).isCloseTo(1.2d, within(1e-9));
		assertThat(ramping.hoursSinceLastDose()).isCloseTo(2.0d, within(1e-9));
		assertThat(peak.phase()).isEqualTo(MedicationPhase.PEAK);
		assertThat(peak.factor()).isCloseTo(1.4d, within(1e-9));
		assertThat(tapering.phase()).isEqualTo(MedicationPhase.TAPERING);
		assertThat(tapering.factor()).isCloseTo(1.2d, within(1e-9));
	}

	@Test
	void usesPreviousDayDoseBeforeTodaysDoseTime() {
		MedicationCourse course = new MedicationCourse("pred", "corticosteroids", null, JANUARY);

		MedicationEffect effect = MedicationFactorCurve.effectAt(course, STEROID, Instant.parse("2026-01-10T07:00:00Z"), UTC);

		assertThat(effect.lastDose()).isEqualTo(Instant.parse("2026-01-09T08:00:00Z"));
		assertThat(effect.phase()).isEqualTo(MedicationPhase.TAPERING);
		assertThat(effect.factor()).isCloseTo(1.0d + 0.4d * (1.0d / 16.0d), within(1e-9));
	}

	@Test
	void isNeutralOutsideSchedule() {
		MedicationCourse course = new MedicationCourse("pred", "corticosteroids", 1.4d, JANUARY);

		MedicationEffect before = MedicationFactorCurve.effectAt(course, STEROID, Instant.parse("2025-12-31T12:00:00Z"), UTC);
		MedicationEffect after = MedicationFactorCurve.effectAt(course, STEROID, Instant.parse("2026-02-01T01:00:00Z"), UTC);

		assertThat(before.phase()).isEqualTo(MedicationPhase.NOT_STARTED);
		assertThat(before.factor()).isEqualTo(1.0d);
		assertThat(after.phase()).isEqualTo(MedicationPhase.ENDED);
		assertThat(after.factor()).isEqualTo(1.0d);
	}

	@Test
	void nonDurationBasedMedicationAppliesConstantFactor() {
		MedicationCourse course = new MedicationCourse("met", "metformin", null, JANUARY);

		MedicationEffect effect = MedicationFactorCurve.effectAt(course, CONSTANT, Instant.parse("2026-01-15T03:00:00Z"), UTC);

		assertThat(effect.phase()).isEqualTo(MedicationPhase.CONSTANT);
		assertThat(effect.factor()).isEqualTo(0.9d);
	}

	@Test
	void courseFactorOverridesProfileFactor() {
		MedicationCourse course = new MedicationCourse("met", "metformin", 0.7d, JANUARY);

		MedicationEffect effect = MedicationFactorCurve.effectAt(course, CONSTANT, Instant.parse("2026-01-15T03:00:00Z"), UTC);

		assertThat(effect.factor()).isEqualTo(0.7d);
	}

	@Test
	void assumesDoseADayAgoWithoutDailyTimes() {
		MedicationSchedule schedule = new MedicationSchedule(LocalDate.of(2026, 1, 1), null, List.of());
		MedicationCourse course = new MedicationCourse("pred", "corticosteroids", null, schedule);

		MedicationEffect effect = MedicationFactorCurve.effectAt(course, STEROID, Instant.parse("2026-03-01T12:00:00Z"), UTC);

		assertThat(effect.phase()).isEqualTo(MedicationPhase.NO_EFFECT);
		assertThat(effect.factor()).isEqualTo(1.0d);
		assertThat(effect.hoursSinceLastDose()).isCloseTo(24.0d, within(1e-9));
	}

	@Test
	void findsLatestOfSeveralDailyTimes() {
		MedicationSchedule schedule = new MedicationSchedule(LocalDate.of(2026, 1, 1), null,
				List.of(LocalTime.of(8, 0), LocalTime.of(20, 0)));

		assertThat(MedicationFactorCurve.findLastDoseTime(schedule, Instant.parse("2026-01-05T21:00:00Z"), UTC))
				.isEqualTo(Instant.parse("2026-01-05T20:00:00Z"));
		assertThat(MedicationFactorCurve.findLastDoseTime(schedule, Instant.parse("2026-01-05T07:00:00Z"), UTC))
				.isEqualTo(Instant.parse("2026-01-04T20:00:00Z"));
		assertThat(MedicationFactorCurve.findLastDoseTime(schedule, Instant.parse("2026-01-05T08:00:00Z"), UTC))
				.isEqualTo(Instant.parse("2026-01-05T08:00:00Z"));
	}

	@Test
	void interpretsDailyTimesInConfiguredZone() {
		MedicationSchedule schedule = new MedicationSchedule(LocalDate.of(2026, 1, 1), null, List.of(LocalTime.of(8, 0)));

		Instant lastDose = MedicationFactorCurve.findLastDoseTime(schedule, Instant.parse("2026-01-05T12:00:00Z"),
				ZoneId.of("Europe/Berlin"));

		assertThat(lastDose).isEqualTo(Instant.parse("2026-01-05T07:00:00Z"));
	}
}
