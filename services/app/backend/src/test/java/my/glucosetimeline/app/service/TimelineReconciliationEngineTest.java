package my.glucosetimeline.app.service;

import my.glucosetimeline.app.domain.ActivityRecord;
import my.glucosetimeline.app.domain.EffectSource;
import my.glucosetimeline.app.domain.GlucoseReading;
import my.glucosetimeline.app.domain.InsulinDose;
import my.glucosetimeline.app.domain.MealRecord;
import my.glucosetimeline.app.domain.MedicationCourse;
import my.glucosetimeline.app.domain.MedicationSchedule;
import my.glucosetimeline.app.domain.ReadingSource;
import my.glucosetimeline.app.model.AbsorptionClass;
import my.glucosetimeline.app.model.ActiveEffects;
import my.glucosetimeline.app.model.ExtensionMode;
import my.glucosetimeline.app.model.GlucoseStatus;
import my.glucosetimeline.app.model.MedicationPhase;
import my.glucosetimeline.app.model.PatientConstants;
import my.glucosetimeline.app.model.PointClassification;
import my.glucosetimeline.app.model.TimeWindow;
import my.glucosetimeline.app.model.TimelineConfigurationException;
import my.glucosetimeline.app.model.TimelineOptions;
import my.glucosetimeline.app.model.TimelinePoint;
import my.glucosetimeline.app.model.TimelineRequest;
import my.glucosetimeline.app.model.TimelineResult;
import my.glucosetimeline.app.model.TimelineWarning;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static my.glucosetimeline.app.service.TimelineFixtures.METFORMIN;
import static my.glucosetimeline.app.service.TimelineFixtures.RAPID;
import static my.glucosetimeline.app.service.TimelineFixtures.T0;
import static my.glucosetimeline.app.service.TimelineFixtures.minutes;
import static my.glucosetimeline.app.service.TimelineFixtures.reading;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TimelineReconciliationEngineTest {
	private final TimelineReconciliationEngine engine = TimelineFixtures.engine();
	private final GlucoseProjectionModel projectionModel = new GlucoseProjectionModel();
	private final PatientConstants constants = PatientConstants.defaults();
	private final TimelineOptions gapFill = TimelineOptions.defaults();
	private final TimelineOptions readingsOnly = TimelineOptions.defaults().withGapFillEnabled(false);

	@Test
	void singleReadingWithoutGapFillComesBackUnchanged() {
		GlucoseReading reading = reading(30, 143.0d);

		TimelineResult result = engine.reconstruct(request(window(0, 120), minutes(60), List.of(reading), List.of(), readingsOnly));

		assertThat(result.points()).hasSize(1);
		TimelinePoint point = result.points().get(0);
		assertThat(point.timestamp()).isEqualTo(reading.timestamp());
		assertThat(point.value()).isEqualTo(143.0d);
		assertThat(point.classification()).isEqualTo(PointClassification.ACTUAL);
		assertThat(point.source()).isEqualTo(reading.source());
		assertThat(point.connectedToPrevious()).isFalse();
		assertThat(result.warnings()).isEmpty();
	}

	@Test
	void returnsEmptyTimelineWithoutReadingsWhenGapFillDisabled() {
		TimelineResult result = engine.reconstruct(request(window(0, 120), T0, List.of(),
				List.of(new InsulinDose("dose", RAPID, 5.0d, T0)), readingsOnly));

		assertThat(result.isEmpty()).isTrue();
		assertThat(result.warnings()).extracting(TimelineWarning::type).containsExactly(TimelineWarning.Type.EMPTY_INPUT);
		assertThat(result.summary().totalActiveInsulin()).isZero();
	}

	@Test
	void marksConnectableReadingPairs() {
		List<GlucoseReading> readings = List.of(reading(0, 110), reading(15, 120), reading(40, 135));

		TimelineResult result = engine.reconstruct(request(window(0, 60), minutes(60), readings, List.of(), readingsOnly));

		assertThat(result.points()).extracting(TimelinePoint::connectedToPrevious).containsExactly(false, true, false);
	}

	@Test
	void projectsFiveUnitDoseAtPeak() {
		GlucoseReading start = reading(0, 250.0d);
		InsulinDose dose = new InsulinDose("dose", RAPID, 5.0d, T0);

		TimelineResult result = engine.reconstruct(request(window(0, 240), T0, List.of(start), List.of(dose), gapFill));

		TimelinePoint atPeak = pointAt(result, minutes(120));
		double natural = projectionModel.naturalValue(250.0d, 120.0d, 100.0d, 2.0d);
		assertThat(atPeak.classification()).isEqualTo(PointClassification.ESTIMATED);
		assertThat(atPeak.totalInsulinActive()).isCloseTo(5.0d, within(1e-9));
		assertThat(atPeak.projectedValue()).isEqualTo(Math.max(40.0d, natural - 5.0d * 50.0d));
		assertThat(atPeak.value()).isEqualTo(40.0d);
		assertThat(atPeak.netEffect()).isCloseTo(-250.0d, within(1e-9));
		assertThat(atPeak.perSourceContributions()).containsOnlyKeys("dose");
		assertThat(atPeak.status()).isEqualTo(GlucoseStatus.LOW);
	}

	@Test
	void historicalEstimatesIgnoreMealWhileFuturePointsIncludeIt() {
		MealRecord meal = new MealRecord("lunch", 60.0d, 0.0d, 0.0d, AbsorptionClass.MEDIUM, T0);
		Instant now = minutes(30);

		TimelineResult result = engine.reconstruct(request(window(0, 120), now, List.of(reading(0, 120.0d)),
				List.of(meal), gapFill));

		TimelinePoint historical = pointAt(result, minutes(15));
		assertThat(historical.historical()).isTrue();
		assertThat(historical.value()).isEqualTo(historical.baselineValue());
		assertThat(historical.baselineValue())
				.isCloseTo(projectionModel.naturalValue(120.0d, 15.0d, 100.0d, 2.0d), within(1e-9));
		assertThat(historical.projectedValue()).isCloseTo(historical.baselineValue() + 120.0d, within(1e-9));

		TimelinePoint future = pointAt(result, minutes(30));
		assertThat(future.historical()).isFalse();
		assertThat(future.value()).isEqualTo(future.projectedValue());
		assertThat(future.value())
				.isCloseTo(projectionModel.naturalValue(120.0d, 30.0d, 100.0d, 2.0d) + 240.0d, within(1e-9));

		assertThat(result.points())
				.filteredOn(point -> point.classification() == PointClassification.ESTIMATED && point.historical())
				.allMatch(point -> point.value() == point.baselineValue());
	}

	@Test
	void seedsTargetAnchorBeforeFirstReading() {
		TimelineResult result = engine.reconstruct(request(window(0, 120), T0, List.of(reading(60, 180.0d)), List.of(), gapFill));

		TimelinePoint first = result.points().get(0);
		assertThat(first.timestamp()).isEqualTo(T0);
		assertThat(first.classification()).isEqualTo(PointClassification.ESTIMATED_ANCHOR);
		assertThat(first.value()).isEqualTo(100.0d);

		assertThat(result.points()).hasSize(9);
		assertThat(result.summary().anchorPoints()).isEqualTo(1);
		assertThat(result.summary().actualPoints()).isEqualTo(1);
		assertThat(result.summary().estimatedPoints()).isEqualTo(7);

		TimelinePoint actual = pointAt(result, minutes(60));
		assertThat(actual.classification()).isEqualTo(PointClassification.ACTUAL);
		assertThat(actual.value()).isEqualTo(180.0d);

		TimelinePoint afterReading = pointAt(result, minutes(75));
		assertThat(afterReading.value()).isCloseTo(100.0d + 80.0d * Math.exp(-3.0d * 15.0d / 120.0d), within(1e-9));
	}

	@Test
	void gridPointsAfterOffGridReadingAreSeededFromIt() {
		TimelineResult result = engine.reconstruct(request(window(0, 120), T0, List.of(reading(50, 200.0d)), List.of(), gapFill));

		assertThat(result.points()).hasSize(10);
		assertThat(pointAt(result, minutes(45)).value())
				.isCloseTo(projectionModel.naturalValue(100.0d, 45.0d, 100.0d, 2.0d), within(1e-9));
		assertThat(pointAt(result, minutes(60)).value())
				.isCloseTo(projectionModel.naturalValue(200.0d, 10.0d, 100.0d, 2.0d), within(1e-9));
	}

	@Test
	void pointsAreOrderedByTimestamp() {
		List<GlucoseReading> readings = List.of(reading(95, 150.0d), reading(50, 200.0d), reading(10, 90.0d));

		TimelineResult result = engine.reconstruct(request(window(0, 180), minutes(100), readings, List.of(), gapFill));

		List<Instant> timestamps = result.points().stream().map(TimelinePoint::timestamp).toList();
		assertThat(timestamps).isSorted();
	}

	@Test
	void seedsAnchorWithoutReadingsWhenGapFillEnabled() {
		TimelineResult result = engine.reconstruct(request(window(0, 60), T0, List.of(), List.of(), gapFill));

		assertThat(result.points()).hasSize(5);
		assertThat(result.points().get(0).classification()).isEqualTo(PointClassification.ESTIMATED_ANCHOR);
		assertThat(result.points()).allMatch(point -> point.value() == 100.0d);
	}

	@Test
	void stopsAtLastReadingWhenExtensionDisabled() {
		TimelineOptions options = gapFill.withExtensionMode(ExtensionMode.NONE);

		TimelineResult result = engine.reconstruct(request(window(0, 180), minutes(200), List.of(reading(30, 120.0d)), List.of(), options));

		assertThat(result.points().get(result.points().size() - 1).timestamp()).isEqualTo(minutes(30));
	}

	@Test
	void extendsOnlyUntilNowWhenRequested() {
		TimelineOptions options = gapFill.withExtensionMode(ExtensionMode.TO_NOW);

		TimelineResult result = engine.reconstruct(request(window(0, 180), minutes(90), List.of(reading(30, 120.0d)), List.of(), options));

		assertThat(result.points().get(result.points().size() - 1).timestamp()).isEqualTo(minutes(90));
	}

	@Test
	void returnToTargetEndsWithTargetAnchor() {
		TimelineOptions options = gapFill.withReturnToTarget(true);

		TimelineResult result = engine.reconstruct(request(window(0, 120), T0, List.of(reading(0, 220.0d)), List.of(), options));

		TimelinePoint last = result.points().get(result.points().size() - 1);
		assertThat(last.timestamp()).isEqualTo(minutes(120));
		assertThat(last.classification()).isEqualTo(PointClassification.ESTIMATED_ANCHOR);
		assertThat(last.value()).isEqualTo(100.0d);
		assertThat(result.points()).extracting(TimelinePoint::timestamp).doesNotHaveDuplicates();
	}

	@Test
	void skipsStartAnchorWhenFillFromStartDisabled() {
		TimelineOptions options = gapFill.withFillFromStart(false);

		TimelineResult result = engine.reconstruct(request(window(0, 120), T0, List.of(reading(60, 150.0d)), List.of(), options));

		assertThat(result.points().get(0).timestamp()).isEqualTo(minutes(60));
		assertThat(result.summary().anchorPoints()).isZero();
	}

	@Test
	void ignoresReadingsOutsideWindow() {
		List<GlucoseReading> readings = List.of(reading(-30, 300.0d), reading(30, 120.0d), reading(400, 90.0d));

		TimelineResult result = engine.reconstruct(request(window(0, 120), minutes(60), readings, List.of(), readingsOnly));

		assertThat(result.points()).extracting(TimelinePoint::value).containsExactly(120.0d);
	}

	@Test
	void nullEntriesAreDroppedWithoutBlankingTimeline() {
		List<GlucoseReading> readings = Arrays.asList(reading(0, 120.0d), null);
		List<EffectSource> sources = Arrays.asList(new InsulinDose("dose", RAPID, 1.0d, T0), null);

		TimelineResult result = engine.reconstruct(request(window(0, 60), T0, readings, sources, gapFill));

		assertThat(result.points()).hasSize(5);
		assertThat(pointAt(result, minutes(60)).perSourceContributions()).containsOnlyKeys("dose");
		assertThat(result.warnings()).extracting(TimelineWarning::type)
				.containsExactly(TimelineWarning.Type.INVALID_RECORD, TimelineWarning.Type.INVALID_RECORD);
	}

	@Test
	void farFutureReadingIsDroppedAsInvalid() {
		List<GlucoseReading> readings = List.of(reading(0, 120.0d), new GlucoseReading(Instant.MAX, 130.0d, ReadingSource.MANUAL));

		TimelineResult result = engine.reconstruct(request(window(0, 60), T0, readings, List.of(), readingsOnly));

		assertThat(result.points()).extracting(TimelinePoint::value).containsExactly(120.0d);
		assertThat(result.warnings()).extracting(TimelineWarning::type).containsExactly(TimelineWarning.Type.INVALID_RECORD);
	}

	@Test
	void activeEffectsAtDistantInstantStayFinite() {
		List<EffectSource> sources = List.of(
				new InsulinDose("dose", RAPID, 3.0d, T0),
				new ActivityRecord("walk", 1, T0, minutes(30))
		);

		ActiveEffects effects = engine.activeEffectsAt(sources, constants, ZoneOffset.UTC, Instant.MAX);

		assertThat(effects.insulin().total()).isZero();
		assertThat(effects.insulinNeedsFactor()).isEqualTo(1.0d);
	}

	@Test
	void unknownInsulinUsesDefaultProfileAndWarnsOnce() {
		List<EffectSource> sources = List.of(
				new InsulinDose("a", "house_blend", 2.0d, T0),
				new InsulinDose("b", "house_blend", 2.0d, minutes(30))
		);

		TimelineResult result = engine.reconstruct(request(window(0, 120), T0, List.of(reading(0, 150.0d)), sources, gapFill));

		assertThat(result.warnings()).extracting(TimelineWarning::type).containsExactly(TimelineWarning.Type.MISSING_PROFILE);
		assertThat(pointAt(result, minutes(120)).totalInsulinActive()).isCloseTo(2.0d + 2.0d * 1.5d / 2.0d, within(1e-9));
	}

	@Test
	void invalidRecordIsDroppedWithoutBlankingTimeline() {
		List<EffectSource> sources = List.of(
				new InsulinDose("broken", RAPID, -4.0d, T0),
				new InsulinDose("fine", RAPID, 1.0d, T0)
		);

		TimelineResult result = engine.reconstruct(request(window(0, 120), T0, List.of(reading(0, 150.0d)), sources, gapFill));

		assertThat(result.points()).isNotEmpty();
		assertThat(result.warnings()).extracting(TimelineWarning::type).containsExactly(TimelineWarning.Type.INVALID_RECORD);
		assertThat(pointAt(result, minutes(120)).perSourceContributions()).containsOnlyKeys("fine");
	}

	@Test
	void activityAndMedicationScaleInsulinImpact() {
		List<EffectSource> sources = List.of(
				new InsulinDose("dose", RAPID, 1.0d, T0),
				new ActivityRecord("run", 2, minutes(60), minutes(120)),
				new MedicationCourse("met", METFORMIN, null, new MedicationSchedule(LocalDate.of(2026, 1, 1), null, List.of()))
		);

		TimelineResult result = engine.reconstruct(request(window(0, 180), T0, List.of(reading(0, 300.0d)), sources, gapFill));

		TimelinePoint point = pointAt(result, minutes(120));
		assertThat(point.insulinNeedsFactor()).isCloseTo(0.72d, within(1e-9));
		assertThat(point.perSourceContributions().get("dose")).isCloseTo(-1.0d * 50.0d / 0.72d, within(1e-9));
	}

	@Test
	void summarizesActiveEffectsAtNow() {
		List<EffectSource> sources = List.of(
				new InsulinDose("dose", RAPID, 4.0d, T0),
				new MealRecord("meal", 60.0d, 0.0d, 0.0d, AbsorptionClass.MEDIUM, minutes(90))
		);

		TimelineResult result = engine.reconstruct(request(window(0, 180), minutes(120), List.of(reading(0, 140.0d)), sources, gapFill));

		assertThat(result.summary().at()).isEqualTo(minutes(120));
		assertThat(result.summary().totalActiveInsulin()).isCloseTo(4.0d, within(1e-9));
		assertThat(result.summary().totalCarbEquivalent()).isCloseTo(60.0d, within(1e-9));
		assertThat(result.summary().activeInsulinById()).containsOnlyKeys("dose");
		assertThat(result.summary().insulinNeedsFactor()).isEqualTo(1.0d);
	}

	@Test
	void totalsStayNonNegativeAcrossTimeline() {
		List<EffectSource> sources = List.of(
				new InsulinDose("dose", RAPID, 8.0d, minutes(20)),
				new MealRecord("meal", 20.0d, 30.0d, 15.0d, 40.0d, AbsorptionClass.VERY_SLOW, minutes(10)),
				new ActivityRecord("nap", -1, minutes(60), minutes(150))
		);

		TimelineResult result = engine.reconstruct(request(window(0, 360), minutes(100), List.of(reading(5, 95.0d)), sources, gapFill));

		assertThat(result.points()).allSatisfy(point -> {
			assertThat(point.totalInsulinActive()).isGreaterThanOrEqualTo(0.0d);
			assertThat(point.totalCarbEquivalentActive()).isGreaterThanOrEqualTo(0.0d);
			assertThat(point.insulinNeedsFactor()).isPositive();
			assertThat(point.value()).isGreaterThanOrEqualTo(40.0d);
		});
	}

	@Test
	void rejectsInvertedWindowBeforeComputation() {
		assertThatThrownBy(() -> new TimeWindow(minutes(60), T0, 15))
				.isInstanceOf(TimelineConfigurationException.class)
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void rejectsMissingNowAndInvalidOptions() {
		assertThatThrownBy(() -> engine.reconstruct(request(window(0, 60), null, List.of(), List.of(), gapFill)))
				.isInstanceOf(TimelineConfigurationException.class);

		TimelineOptions badStabilization = new TimelineOptions(true, true, ExtensionMode.TO_WINDOW_END, false, 20, 0.0d, 40.0d, ZoneOffset.UTC);
		assertThatThrownBy(() -> engine.reconstruct(request(window(0, 60), T0, List.of(), List.of(), badStabilization)))
				.isInstanceOf(TimelineConfigurationException.class);

		TimelineOptions badGap = new TimelineOptions(true, true, ExtensionMode.TO_WINDOW_END, false, -1, 2.0d, 40.0d, ZoneOffset.UTC);
		assertThatThrownBy(() -> engine.reconstruct(request(window(0, 60), T0, List.of(), List.of(), badGap)))
				.isInstanceOf(TimelineConfigurationException.class);
	}

	@Test
	void reportsActiveEffectsWithMedicationPhase() {
		List<EffectSource> sources = List.of(
				new InsulinDose("dose", RAPID, 3.0d, T0),
				new MedicationCourse("met", METFORMIN, null, new MedicationSchedule(LocalDate.of(2026, 1, 1), null, List.of()))
		);

		ActiveEffects effects = engine.activeEffectsAt(sources, constants, ZoneOffset.UTC, minutes(60));

		assertThat(effects.insulin().total()).isCloseTo(1.5d, within(1e-9));
		assertThat(effects.medication().total()).isCloseTo(0.9d, within(1e-9));
		assertThat(effects.insulinNeedsFactor()).isCloseTo(0.9d, within(1e-9));
		assertThat(effects.medications()).hasSize(1);
		assertThat(effects.medications().get(0).effect().phase()).isEqualTo(MedicationPhase.CONSTANT);
	}

	@Test
	void repeatedInvocationsGiveIdenticalResults() {
		List<EffectSource> sources = List.of(new InsulinDose("dose", RAPID, 5.0d, T0));
		TimelineRequest request = request(window(0, 240), minutes(60), List.of(reading(0, 180.0d)), sources, gapFill);

		assertThat(engine.reconstruct(request)).isEqualTo(engine.reconstruct(request));
	}

	private TimelineRequest request(TimeWindow window, Instant now, List<GlucoseReading> readings,
									List<EffectSource> sources, TimelineOptions options) {
		return new TimelineRequest(window, now, readings, sources, constants, options);
	}

	private TimeWindow window(long startMinutes, long endMinutes) {
		return new TimeWindow(minutes(startMinutes), minutes(endMinutes), 15);
	}

	private TimelinePoint pointAt(TimelineResult result, Instant timestamp) {
		return result.points().stream()
				.filter(point -> point.timestamp().equals(timestamp))
				.findFirst()
				.orElseThrow(() -> new AssertionError("No point at " + timestamp));
	}
}
