package my.glucosetimeline.app.service;

import my.glucosetimeline.app.domain.EffectSource;
import my.glucosetimeline.app.domain.GlucoseReading;
import my.glucosetimeline.app.domain.MedicationCourse;
import my.glucosetimeline.app.kinetics.EffectCurves;
import my.glucosetimeline.app.kinetics.KineticProfileResolver;
import my.glucosetimeline.app.kinetics.ProfileLookup;
import my.glucosetimeline.app.model.ActiveEffects;
import my.glucosetimeline.app.model.EffectAggregate;
import my.glucosetimeline.app.model.EffectCategory;
import my.glucosetimeline.app.model.ExtensionMode;
import my.glucosetimeline.app.model.GlucoseStatus;
import my.glucosetimeline.app.model.MedicationStatus;
import my.glucosetimeline.app.model.PatientConstants;
import my.glucosetimeline.app.model.PointClassification;
import my.glucosetimeline.app.model.ReadingPair;
import my.glucosetimeline.app.model.TimeWindow;
import my.glucosetimeline.app.model.TimelineConfigurationException;
import my.glucosetimeline.app.model.TimelineOptions;
import my.glucosetimeline.app.model.TimelinePoint;
import my.glucosetimeline.app.model.TimelineRequest;
import my.glucosetimeline.app.model.TimelineResult;
import my.glucosetimeline.app.model.TimelineSummary;
import my.glucosetimeline.app.model.TimelineWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconstructs a glucose timeline from sparse readings and effect sources.
 * <p>
 * Actual readings are emitted unchanged. With gap-fill enabled, a target-valued anchor is seeded at the
 * window start when it precedes the first reading, and estimated points are laid on the window grid,
 * each projected from the nearest preceding anchor. Estimated points before {@code now} show the
 * drift-only baseline; points at or after {@code now} include insulin and meal overlays.
 */
@Service
public class TimelineReconciliationEngine {
	private static final Logger logger = LoggerFactory.getLogger(TimelineReconciliationEngine.class);

	private final KineticProfileResolver profileResolver;
	private final ActiveEffectAggregator aggregator;
	private final GlucoseProjectionModel projectionModel;
	private final ReadingConnectivity connectivity;
	private final RecordSanitizer sanitizer;

	public TimelineReconciliationEngine(KineticProfileResolver profileResolver,
										ActiveEffectAggregator aggregator,
										GlucoseProjectionModel projectionModel,
										ReadingConnectivity connectivity,
										RecordSanitizer sanitizer) {
		this.profileResolver = profileResolver;
		this.aggregator = aggregator;
		this.projectionModel = projectionModel;
		this.connectivity = connectivity;
		this.sanitizer = sanitizer;
	}

	public TimelineResult reconstruct(TimelineRequest request) {
		validate(request);
		TimeWindow window = request.window();
		TimelineOptions options = request.options();

		RecordSanitizer.SanitizedInput input = sanitizer.sanitize(request.readings(), request.sources());
		List<TimelineWarning> warnings = new ArrayList<>(input.warnings());
		List<GlucoseReading> readings = input.readings().stream()
				.filter(reading -> window.contains(reading.timestamp()))
				.toList();

		ProfileLookup lookup = new ProfileLookup(profileResolver, request.constants());
		Computation computation = new Computation(request, input.sources(), new EffectCurves(lookup, options.zoneId()));

		List<TimelinePoint> points;
		if (!options.gapFillEnabled()) {
			points = computation.actualPoints(readings);
		} else {
			points = computation.gapFilledPoints(readings);
		}
		if (points.isEmpty()) {
			warnings.add(new TimelineWarning(TimelineWarning.Type.EMPTY_INPUT, null,
					"No usable readings in window and gap-fill is disabled"));
		}
		TimelineSummary summary = computation.summarize(points);
		warnings.addAll(lookup.warnings());

		logger.info("Reconstructed timeline {}..{}: {} actual, {} anchor, {} estimated points, {} warnings",
				window.start(), window.end(), summary.actualPoints(), summary.anchorPoints(),
				summary.estimatedPoints(), warnings.size());
		return new TimelineResult(points, summary, warnings);
	}

	/**
	 * Active insulin, carbohydrate equivalent and multipliers at {@code at}, with medication phases.
	 */
	public ActiveEffects activeEffectsAt(List<EffectSource> sources, PatientConstants constants, ZoneId zoneId, Instant at) {
		if (at == null) {
			throw new TimelineConfigurationException("at", "Timestamp is required");
		}
		PatientConstants resolvedConstants = constants == null ? PatientConstants.defaults() : constants;
		RecordSanitizer.SanitizedInput input = sanitizer.sanitize(List.of(), sources);
		ProfileLookup lookup = new ProfileLookup(profileResolver, resolvedConstants);
		EffectCurves curves = new EffectCurves(lookup, zoneId == null ? TimelineOptions.defaults().zoneId() : zoneId);

		List<EffectSource> valid = input.sources();
		EffectAggregate insulin = aggregator.aggregate(valid, EffectCategory.INSULIN, at, curves);
		EffectAggregate carbohydrate = aggregator.aggregate(valid, EffectCategory.CARBOHYDRATE, at, curves);
		EffectAggregate activity = aggregator.aggregate(valid, EffectCategory.ACTIVITY, at, curves);
		EffectAggregate medication = aggregator.aggregate(valid, EffectCategory.MEDICATION, at, curves);
		List<MedicationStatus> medications = new ArrayList<>();
		for (EffectSource source : valid) {
			if (source instanceof MedicationCourse course) {
				medications.add(new MedicationStatus(course.id(), course.medicationId(), curves.medicationEffectAt(course, at)));
			}
		}
		List<TimelineWarning> warnings = new ArrayList<>(input.warnings());
		warnings.addAll(lookup.warnings());
		double needs = aggregator.insulinNeedsFactor(valid, at, curves);
		return new ActiveEffects(at, insulin, carbohydrate, activity, medication, needs, medications, warnings);
	}

	private void validate(TimelineRequest request) {
		if (request == null || request.window() == null) {
			throw new TimelineConfigurationException("window", "Timeline window is required");
		}
		if (request.now() == null) {
			throw new TimelineConfigurationException("now", "Reference time 'now' is required");
		}
		request.options().validate();
	}

	private record Anchor(Instant timestamp, double value) {
	}

	private record EffectSnapshot(double insulinActive,
								  double carbEquivalentActive,
								  double insulinNeedsFactor,
								  Map<String, Double> contributions,
								  double netEffect) {
	}

	/**
	 * State of one reconstruction; discarded when the call returns.
	 */
	private final class Computation {
		private final TimelineRequest request;
		private final List<EffectSource> sources;
		private final EffectCurves curves;
		private final PatientConstants constants;
		private final TimelineOptions options;

		private Computation(TimelineRequest request, List<EffectSource> sources, EffectCurves curves) {
			this.request = request;
			this.sources = sources;
			this.curves = curves;
			this.constants = request.constants();
			this.options = request.options();
		}

		private List<TimelinePoint> actualPoints(List<GlucoseReading> readings) {
			List<ReadingPair> pairs = connectivity.classify(readings, options.maxConnectGapMinutes());
			List<TimelinePoint> points = new ArrayList<>(readings.size());
			for (int i = 0; i < readings.size(); i++) {
				boolean connected = i > 0 && pairs.get(i - 1).connectable();
				points.add(actualPoint(readings.get(i), connected));
			}
			return points;
		}

		private List<TimelinePoint> gapFilledPoints(List<GlucoseReading> readings) {
			TimeWindow window = request.window();
			List<TimelinePoint> points = new ArrayList<>(actualPoints(readings));
			List<Anchor> anchors = new ArrayList<>();
			boolean seedStart = readings.isEmpty()
					|| (options.fillFromStart() && window.start().isBefore(readings.get(0).timestamp()));
			if (seedStart) {
				anchors.add(new Anchor(window.start(), constants.targetGlucose()));
				points.add(anchorPoint(window.start(), constants.targetGlucose()));
			}
			Set<Instant> occupied = new HashSet<>();
			for (GlucoseReading reading : readings) {
				anchors.add(new Anchor(reading.timestamp(), reading.value()));
				occupied.add(reading.timestamp());
			}
			if (seedStart) {
				occupied.add(window.start());
			}

			Instant lastAnchor = anchors.get(anchors.size() - 1).timestamp();
			Instant extensionEnd = extensionEnd(lastAnchor);
			boolean returnToTarget = options.returnToTarget() && extensionEnd.isAfter(lastAnchor);
			if (returnToTarget) {
				occupied.add(extensionEnd);
			}

			int anchorIndex = 0;
			Instant first = anchors.get(0).timestamp();
			for (Instant t = window.start(); !t.isAfter(extensionEnd); t = t.plus(window.interval())) {
				if (t.isBefore(first) || occupied.contains(t)) {
					continue;
				}
				while (anchorIndex + 1 < anchors.size() && !anchors.get(anchorIndex + 1).timestamp().isAfter(t)) {
					anchorIndex++;
				}
				points.add(estimatedPoint(t, anchors.get(anchorIndex)));
			}
			if (returnToTarget) {
				points.add(anchorPoint(extensionEnd, constants.targetGlucose()));
			}
			points.sort(Comparator.comparing(TimelinePoint::timestamp));
			return points;
		}

		private Instant extensionEnd(Instant lastAnchor) {
			TimeWindow window = request.window();
			ExtensionMode mode = options.extensionMode();
			if (mode == ExtensionMode.TO_WINDOW_END) {
				return window.end();
			}
			if (mode == ExtensionMode.TO_NOW) {
				Instant limit = request.now().isAfter(window.end()) ? window.end() : request.now();
				return limit.isAfter(lastAnchor) ? limit : lastAnchor;
			}
			return lastAnchor;
		}

		private TimelinePoint actualPoint(GlucoseReading reading, boolean connectedToPrevious) {
			EffectSnapshot effects = effectsAt(reading.timestamp());
			return new TimelinePoint(reading.timestamp(), reading.value(), PointClassification.ACTUAL,
					isHistorical(reading.timestamp()), reading.value(), reading.value(), effects.contributions(),
					effects.insulinActive(), effects.carbEquivalentActive(), effects.insulinNeedsFactor(),
					effects.netEffect(), GlucoseStatus.classify(reading.value(), constants.targetGlucose()),
					connectedToPrevious, reading.source());
		}

		private TimelinePoint anchorPoint(Instant timestamp, double value) {
			EffectSnapshot effects = effectsAt(timestamp);
			return new TimelinePoint(timestamp, value, PointClassification.ESTIMATED_ANCHOR, isHistorical(timestamp),
					value, value, effects.contributions(), effects.insulinActive(), effects.carbEquivalentActive(),
					effects.insulinNeedsFactor(), effects.netEffect(), GlucoseStatus.classify(value, constants.targetGlucose()),
					false, null);
		}

		private TimelinePoint estimatedPoint(Instant timestamp, Anchor anchor) {
			EffectSnapshot effects = effectsAt(timestamp);
			double elapsedMinutes = EffectCurves.hoursBetween(anchor.timestamp(), timestamp) * 60.0d;
			double baseline = projectionModel.baselineValue(anchor.value(), elapsedMinutes, constants.targetGlucose(),
					options.stabilizationHours(), options.safetyFloor());
			double projected = projectionModel.projectGlucose(anchor.value(), elapsedMinutes, constants.targetGlucose(),
					effects.insulinActive(), effects.carbEquivalentActive(), options.stabilizationHours(), constants,
					effects.insulinNeedsFactor(), options.safetyFloor());
			boolean historical = isHistorical(timestamp);
			double value = historical ? baseline : projected;
			if (logger.isDebugEnabled()) {
				logger.debug("Estimated {} from anchor {}: baseline={} projected={} historical={}",
						timestamp, anchor.timestamp(), baseline, projected, historical);
			}
			return new TimelinePoint(timestamp, value, PointClassification.ESTIMATED, historical, baseline, projected,
					effects.contributions(), effects.insulinActive(), effects.carbEquivalentActive(),
					effects.insulinNeedsFactor(), effects.netEffect(), GlucoseStatus.classify(value, constants.targetGlucose()),
					false, null);
		}

		private EffectSnapshot effectsAt(Instant timestamp) {
			EffectAggregate insulin = aggregator.aggregate(sources, EffectCategory.INSULIN, timestamp, curves);
			EffectAggregate carbs = aggregator.aggregate(sources, EffectCategory.CARBOHYDRATE, timestamp, curves);
			double needs = aggregator.insulinNeedsFactor(sources, timestamp, curves);
			Map<String, Double> contributions = new LinkedHashMap<>();
			double net = 0.0d;
			for (Map.Entry<String, Double> entry : insulin.byId().entrySet()) {
				double impact = -projectionModel.insulinImpact(entry.getValue(), constants, needs);
				contributions.merge(entry.getKey(), impact, Double::sum);
				net += impact;
			}
			for (Map.Entry<String, Double> entry : carbs.byId().entrySet()) {
				double impact = projectionModel.carbImpact(entry.getValue(), constants);
				contributions.merge(entry.getKey(), impact, Double::sum);
				net += impact;
			}
			return new EffectSnapshot(insulin.total(), carbs.total(), needs, contributions, net);
		}

		private boolean isHistorical(Instant timestamp) {
			return timestamp.isBefore(request.now());
		}

		private TimelineSummary summarize(List<TimelinePoint> points) {
			Instant now = request.now();
			EffectAggregate insulin = aggregator.aggregate(sources, EffectCategory.INSULIN, now, curves);
			EffectAggregate carbs = aggregator.aggregate(sources, EffectCategory.CARBOHYDRATE, now, curves);
			EffectAggregate activity = aggregator.aggregate(sources, EffectCategory.ACTIVITY, now, curves);
			EffectAggregate medication = aggregator.aggregate(sources, EffectCategory.MEDICATION, now, curves);
			Map<String, Double> multipliers = new LinkedHashMap<>(activity.byId());
			medication.byId().forEach((id, factor) -> multipliers.merge(id, factor, (left, right) -> left * right));
			int actual = 0;
			int anchors = 0;
			int estimated = 0;
			for (TimelinePoint point : points) {
				switch (point.classification()) {
					case ACTUAL -> actual++;
					case ESTIMATED_ANCHOR -> anchors++;
					case ESTIMATED -> estimated++;
				}
			}
			return new TimelineSummary(now, insulin.total(), carbs.total(), aggregator.insulinNeedsFactor(sources, now, curves),
					insulin.byId(), carbs.byId(), multipliers, actual, anchors, estimated);
		}
	}
}
