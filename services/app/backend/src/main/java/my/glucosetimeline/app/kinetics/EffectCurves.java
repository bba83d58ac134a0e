package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.domain.ActivityRecord;
import my.glucosetimeline.app.domain.EffectSource;
import my.glucosetimeline.app.domain.InsulinDose;
import my.glucosetimeline.app.domain.MealRecord;
import my.glucosetimeline.app.domain.MedicationCourse;
import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.MedicationEffect;
import my.glucosetimeline.app.model.PatientConstants;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Single dispatch point from an {@link EffectSource} to its curve. Additive sources yield a magnitude
 * (insulin units, carbohydrate-equivalent grams), multiplicative sources yield a factor around 1.0.
 */
public class EffectCurves {
	private final ProfileLookup lookup;
	private final ZoneId zoneId;

	public EffectCurves(ProfileLookup lookup, ZoneId zoneId) {
		this.lookup = lookup;
		this.zoneId = zoneId;
	}

	public PatientConstants constants() {
		return lookup.constants();
	}

	public KineticProfile profileFor(EffectSource source) {
		if (source instanceof InsulinDose dose) {
			return lookup.resolve(dose.medicationId()).profile();
		}
		if (source instanceof MedicationCourse course) {
			return lookup.resolve(course.medicationId()).profile();
		}
		if (source instanceof MealRecord meal) {
			return MealAbsorptionCurve.profileFor(meal, constants());
		}
		if (source instanceof ActivityRecord activity) {
			return ActivityImpactCurve.profileFor(activity);
		}
		throw new IllegalStateException("Unsupported effect source " + source.getClass().getSimpleName());
	}

	public double valueAt(EffectSource source, Instant at) {
		if (source instanceof InsulinDose dose) {
			return InsulinActionCurve.effectAt(dose.units(), profileFor(dose), elapsedHours(dose, at));
		}
		if (source instanceof MealRecord meal) {
			PatientConstants constants = constants();
			return MealAbsorptionCurve.effectAt(MealAbsorptionCurve.carbEquivalent(meal, constants),
					profileFor(meal), constants.absorptionModifier(meal.absorptionClass()), elapsedHours(meal, at));
		}
		if (source instanceof ActivityRecord activity) {
			return ActivityImpactCurve.multiplierAt(activity, constants(), elapsedHours(activity, at));
		}
		if (source instanceof MedicationCourse course) {
			return medicationEffectAt(course, at).factor();
		}
		throw new IllegalStateException("Unsupported effect source " + source.getClass().getSimpleName());
	}

	public MedicationEffect medicationEffectAt(MedicationCourse course, Instant at) {
		return MedicationFactorCurve.effectAt(course, profileFor(course), at, zoneId);
	}

	/**
	 * Whether the source contributes at {@code at}; an activity or medication at a neutral factor of exactly 1.0
	 * still counts while it is within its active window.
	 */
	public boolean isActive(EffectSource source, Instant at) {
		if (source instanceof ActivityRecord activity) {
			return ActivityImpactCurve.intensityAt(activity, elapsedHours(activity, at)) > 0;
		}
		if (source instanceof MedicationCourse course) {
			return medicationEffectAt(course, at).isActive();
		}
		return valueAt(source, at) > 0;
	}

	public static double elapsedHours(EffectSource source, Instant at) {
		Instant start = source.startsAt();
		if (start == null || at == null) {
			return Double.NaN;
		}
		return hoursBetween(start, at);
	}

	/**
	 * Signed hours from {@code from} to {@code to}, valid over the whole {@link Instant} range.
	 */
	public static double hoursBetween(Instant from, Instant to) {
		Duration duration = Duration.between(from, to);
		return duration.getSeconds() / 3_600.0d + duration.getNano() / 3_600_000_000_000.0d;
	}
}
