package my.glucosetimeline.app.service;

import my.glucosetimeline.app.domain.ActivityRecord;
import my.glucosetimeline.app.domain.EffectSource;
import my.glucosetimeline.app.domain.GlucoseReading;
import my.glucosetimeline.app.domain.InsulinDose;
import my.glucosetimeline.app.domain.MealRecord;
import my.glucosetimeline.app.domain.MedicationCourse;
import my.glucosetimeline.app.model.TimelineWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Drops records that cannot take part in a computation: non-finite or negative magnitudes, missing ids and
 * timestamps at or before the epoch or past the year 9999. Each dropped record becomes an {@code INVALID_RECORD} warning.
 */
@Component
public class RecordSanitizer {
	private static final Logger logger = LoggerFactory.getLogger(RecordSanitizer.class);
	private static final Instant LATEST_TIMESTAMP = Instant.parse("9999-12-31T23:59:59Z");

	public SanitizedInput sanitize(List<GlucoseReading> readings, List<EffectSource> sources) {
		List<TimelineWarning> warnings = new ArrayList<>();
		List<GlucoseReading> keptReadings = new ArrayList<>();
		if (readings != null) {
			for (GlucoseReading reading : readings) {
				String problem = readingProblem(reading);
				if (problem == null) {
					keptReadings.add(reading);
				} else {
					warnings.add(invalid(reading == null ? null : String.valueOf(reading.timestamp()), "reading " + problem));
				}
			}
		}
		keptReadings.sort(Comparator.comparing(GlucoseReading::timestamp));

		List<EffectSource> keptSources = new ArrayList<>();
		if (sources != null) {
			for (EffectSource source : sources) {
				String problem = sourceProblem(source);
				if (problem == null) {
					keptSources.add(source);
				} else {
					warnings.add(invalid(source == null ? null : source.id(), problem));
				}
			}
		}
		if (!warnings.isEmpty()) {
			logger.warn("Dropped {} invalid records before computation", warnings.size());
		}
		return new SanitizedInput(keptReadings, keptSources, warnings);
	}

	private String readingProblem(GlucoseReading reading) {
		if (reading == null) {
			return "is missing";
		}
		if (!isValidTimestamp(reading.timestamp())) {
			return "has no valid timestamp";
		}
		if (!Double.isFinite(reading.value()) || reading.value() <= 0) {
			return "has non-positive value " + reading.value();
		}
		return null;
	}

	private String sourceProblem(EffectSource source) {
		if (source == null) {
			return "effect source is missing";
		}
		if (source.id() == null || source.id().isBlank()) {
			return source.category() + " source has no id";
		}
		if (source instanceof InsulinDose dose) {
			if (!isValidTimestamp(dose.administeredAt())) {
				return "insulin dose " + dose.id() + " has no valid administration time";
			}
			if (!Double.isFinite(dose.units()) || dose.units() <= 0) {
				return "insulin dose " + dose.id() + " has non-positive units";
			}
			return null;
		}
		if (source instanceof MealRecord meal) {
			if (!isValidTimestamp(meal.occurredAt())) {
				return "meal " + meal.id() + " has no valid time";
			}
			if (!isNonNegative(meal.carbsGrams()) || !isNonNegative(meal.proteinGrams())
					|| !isNonNegative(meal.fatGrams()) || !isNonNegative(meal.fiberGrams())) {
				return "meal " + meal.id() + " has a negative or non-numeric macronutrient";
			}
			return null;
		}
		if (source instanceof ActivityRecord activity) {
			if (!isValidTimestamp(activity.startAt()) || !isValidTimestamp(activity.endAt())) {
				return "activity " + activity.id() + " has no valid start or end";
			}
			if (activity.endAt().isBefore(activity.startAt())) {
				return "activity " + activity.id() + " ends before it starts";
			}
			return null;
		}
		if (source instanceof MedicationCourse course) {
			if (course.schedule() == null || course.schedule().startDate() == null) {
				return "medication " + course.id() + " has no schedule start";
			}
			if (course.schedule().endDate() != null && course.schedule().endDate().isBefore(course.schedule().startDate())) {
				return "medication " + course.id() + " schedule ends before it starts";
			}
			if (course.factor() != null && (!Double.isFinite(course.factor()) || course.factor() <= 0)) {
				return "medication " + course.id() + " has a non-positive factor";
			}
			return null;
		}
		return null;
	}

	private boolean isValidTimestamp(Instant timestamp) {
		return timestamp != null && timestamp.isAfter(Instant.EPOCH) && !timestamp.isAfter(LATEST_TIMESTAMP);
	}

	private boolean isNonNegative(double value) {
		return Double.isFinite(value) && value >= 0;
	}

	private TimelineWarning invalid(String sourceId, String message) {
		return new TimelineWarning(TimelineWarning.Type.INVALID_RECORD, sourceId, "Dropped " + message);
	}

	public record SanitizedInput(List<GlucoseReading> readings, List<EffectSource> sources, List<TimelineWarning> warnings) {
		public SanitizedInput {
			readings = List.copyOf(readings);
			sources = List.copyOf(sources);
			warnings = List.copyOf(warnings);
		}
	}
}
