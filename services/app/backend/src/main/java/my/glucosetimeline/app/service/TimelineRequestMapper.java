package my.glucosetimeline.app.service;

import my.glucosetimeline.app.domain.ActivityRecord;
import my.glucosetimeline.app.domain.EffectSource;
import my.glucosetimeline.app.domain.GlucoseReading;
import my.glucosetimeline.app.domain.InsulinDose;
import my.glucosetimeline.app.domain.MealRecord;
import my.glucosetimeline.app.domain.MedicationCourse;
import my.glucosetimeline.app.domain.MedicationSchedule;
import my.glucosetimeline.app.domain.ReadingSource;
import my.glucosetimeline.app.dto.ActivityDto;
import my.glucosetimeline.app.dto.GlucoseReadingDto;
import my.glucosetimeline.app.dto.InsulinDoseDto;
import my.glucosetimeline.app.dto.KineticProfileDto;
import my.glucosetimeline.app.dto.MealDto;
import my.glucosetimeline.app.dto.MedicationCourseDto;
import my.glucosetimeline.app.dto.NutritionDto;
import my.glucosetimeline.app.dto.PatientConstantsDto;
import my.glucosetimeline.app.dto.TimeWindowDto;
import my.glucosetimeline.app.dto.TimelineOptionsDto;
import my.glucosetimeline.app.model.AbsorptionClass;
import my.glucosetimeline.app.model.ExtensionMode;
import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.PatientConstants;
import my.glucosetimeline.app.model.ProfileShape;
import my.glucosetimeline.app.model.TimeWindow;
import my.glucosetimeline.app.model.TimelineOptions;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts request payloads into engine inputs. Missing numbers become NaN so the sanitizer drops the record
 * with a warning; missing ids are generated from the record's position.
 */
@Component
public class TimelineRequestMapper {
	public TimeWindow toWindow(TimeWindowDto dto, int defaultIntervalMinutes) {
		if (dto == null) {
			return new TimeWindow(null, null, defaultIntervalMinutes);
		}
		int interval = dto.intervalMinutes() == null ? defaultIntervalMinutes : dto.intervalMinutes();
		return new TimeWindow(dto.start(), dto.end(), interval);
	}

	public List<GlucoseReading> toReadings(List<GlucoseReadingDto> readings) {
		if (readings == null) {
			return List.of();
		}
		List<GlucoseReading> result = new ArrayList<>(readings.size());
		for (GlucoseReadingDto reading : readings) {
			if (reading == null) {
				continue;
			}
			result.add(new GlucoseReading(reading.timestamp(), number(reading.value()), ReadingSource.from(reading.source())));
		}
		return result;
	}

	public List<EffectSource> toSources(List<InsulinDoseDto> insulinDoses,
										List<MealDto> meals,
										List<ActivityDto> activities,
										List<MedicationCourseDto> medications) {
		List<EffectSource> sources = new ArrayList<>();
		int index = 0;
		for (InsulinDoseDto dose : nonNull(insulinDoses)) {
			index++;
			sources.add(toInsulinDose(dose, index));
		}
		index = 0;
		for (MealDto meal : nonNull(meals)) {
			index++;
			sources.add(toMeal(meal, index));
		}
		index = 0;
		for (ActivityDto activity : nonNull(activities)) {
			index++;
			sources.add(new ActivityRecord(idOr(activity.id(), "activity", index),
					activity.level() == null ? 0 : activity.level(), activity.startTime(), activity.endTime()));
		}
		index = 0;
		for (MedicationCourseDto medication : nonNull(medications)) {
			index++;
			List<LocalTime> times = medication.dailyTimes() == null
					? List.of()
					: medication.dailyTimes().stream().filter(Objects::nonNull).toList();
			sources.add(new MedicationCourse(idOr(medication.id(), "medication", index), medication.medication(),
					medication.factor(), new MedicationSchedule(medication.startDate(), medication.endDate(), times)));
		}
		return sources;
	}

	public InsulinDose toInsulinDose(InsulinDoseDto dose, int index) {
		return new InsulinDose(idOr(dose.id(), "insulin", index), dose.medication(), number(dose.dose()),
				dose.takenAt() != null ? dose.takenAt() : dose.scheduledTime());
	}

	public MealRecord toMeal(MealDto meal, int index) {
		NutritionDto nutrition = meal.nutrition();
		if (nutrition == null) {
			return new MealRecord(idOr(meal.id(), "meal", index), Double.NaN, 0.0d, 0.0d, 0.0d,
					AbsorptionClass.MEDIUM, meal.timestamp());
		}
		return new MealRecord(idOr(meal.id(), "meal", index),
				number(nutrition.carbs()),
				zeroIfAbsent(nutrition.protein()),
				zeroIfAbsent(nutrition.fat()),
				zeroIfAbsent(nutrition.fiber()),
				AbsorptionClass.from(nutrition.absorptionType()),
				meal.timestamp());
	}

	public PatientConstants mergeConstants(PatientConstantsDto dto, PatientConstants defaults) {
		if (dto == null) {
			return defaults;
		}
		Map<AbsorptionClass, Double> modifiers = new EnumMap<>(AbsorptionClass.class);
		modifiers.putAll(defaults.absorptionModifiers());
		if (dto.absorptionModifiers() != null) {
			dto.absorptionModifiers().forEach((key, value) -> {
				if (value != null) {
					modifiers.put(AbsorptionClass.from(key), value);
				}
			});
		}
		Map<Integer, Double> coefficients = new HashMap<>(defaults.activityCoefficients());
		if (dto.activityCoefficients() != null) {
			dto.activityCoefficients().forEach((key, value) -> {
				if (key != null && value != null) {
					coefficients.put(key, value);
				}
			});
		}
		Map<String, KineticProfile> medicationFactors = new HashMap<>(defaults.medicationFactors());
		if (dto.medicationFactors() != null) {
			dto.medicationFactors().forEach((key, value) -> {
				if (key != null && value != null) {
					medicationFactors.put(key, toProfile(key, value));
				}
			});
		}
		return new PatientConstants(
				valueOr(dto.targetGlucose(), defaults.targetGlucose()),
				valueOr(dto.correctionFactor(), defaults.correctionFactor()),
				valueOr(dto.insulinSensitivityFactor(), defaults.insulinSensitivityFactor()),
				valueOr(dto.carbToBgFactor(), defaults.carbToBgFactor()),
				valueOr(dto.proteinFactor(), defaults.proteinFactor()),
				valueOr(dto.fatFactor(), defaults.fatFactor()),
				valueOr(dto.fiberFactor(), defaults.fiberFactor()),
				modifiers,
				coefficients,
				medicationFactors
		);
	}

	public TimelineOptions mergeOptions(TimelineOptionsDto dto, TimelineOptions defaults) {
		if (dto == null) {
			return defaults;
		}
		return new TimelineOptions(
				valueOr(dto.gapFillEnabled(), defaults.gapFillEnabled()),
				valueOr(dto.fillFromStart(), defaults.fillFromStart()),
				ExtensionMode.from(dto.extension(), defaults.extensionMode()),
				valueOr(dto.returnToTarget(), defaults.returnToTarget()),
				valueOr(dto.maxConnectGapMinutes(), defaults.maxConnectGapMinutes()),
				valueOr(dto.stabilizationHours(), defaults.stabilizationHours()),
				valueOr(dto.safetyFloor(), defaults.safetyFloor()),
				zoneOr(dto.zoneId(), defaults.zoneId())
		);
	}

	public ZoneId zoneOr(String raw, ZoneId fallback) {
		if (raw == null || raw.isBlank()) {
			return fallback;
		}
		try {
			return ZoneId.of(raw.trim());
		} catch (DateTimeException ex) {
			throw new IllegalArgumentException("Unknown zone id '" + raw + "'", ex);
		}
	}

	private KineticProfile toProfile(String id, KineticProfileDto dto) {
		if (dto.durationHours() == null && !Boolean.FALSE.equals(dto.durationBased())) {
			throw new IllegalArgumentException("Medication factor " + id + " needs durationHours");
		}
		ProfileShape shape = ProfileShape.from(dto.shape(), dto.peakHours());
		try {
			return new KineticProfile(
					valueOr(dto.onsetHours(), 0.0d),
					shape == ProfileShape.PEAKLESS ? null : dto.peakHours(),
					valueOr(dto.durationHours(), 0.0d),
					shape,
					!Boolean.FALSE.equals(dto.durationBased()),
					valueOr(dto.factor(), 1.0d));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Medication factor " + id + ": " + ex.getMessage(), ex);
		}
	}

	private static <T> List<T> nonNull(List<T> values) {
		if (values == null) {
			return List.of();
		}
		return values.stream().filter(Objects::nonNull).toList();
	}

	private static String idOr(String id, String prefix, int index) {
		return id == null || id.isBlank() ? prefix + "-" + index : id;
	}

	private static double number(Double value) {
		return value == null ? Double.NaN : value;
	}

	private static double zeroIfAbsent(Double value) {
		return value == null ? 0.0d : value;
	}

	private static <T> T valueOr(T value, T fallback) {
		return value == null ? fallback : value;
	}
}
