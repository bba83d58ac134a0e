package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.domain.MealRecord;
import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.PatientConstants;

/**
 * Carbohydrate-equivalent grams still being absorbed from a meal.
 * <p>
 * Fat and protein lengthen the absorption window, a carb-heavy meal peaks earlier, and the absorption
 * modifier divides both peak and duration. The same modifier is the exponent of the rise and decay, so
 * fast meals rise convexly and fall steeply while slow meals rise concavely with a longer tail.
 */
public final class MealAbsorptionCurve {
	private static final double BASE_DURATION_HOURS = 2.0d;
	private static final double FAT_DURATION_HOURS_PER_GRAM = 0.02d;
	private static final double PROTEIN_DURATION_HOURS_PER_GRAM = 0.01d;
	private static final double BASE_PEAK_HOURS = 0.5d;

	private MealAbsorptionCurve() {
	}

	public static double carbEquivalent(MealRecord meal, PatientConstants constants) {
		double value = meal.carbsGrams()
				+ meal.proteinGrams() * constants.proteinFactor()
				+ meal.fatGrams() * constants.fatFactor()
				- meal.fiberGrams() * constants.fiberFactor();
		return Math.max(0.0d, value);
	}

	public static KineticProfile profileFor(MealRecord meal, PatientConstants constants) {
		double modifier = constants.absorptionModifier(meal.absorptionClass());
		double duration = (BASE_DURATION_HOURS
				+ meal.fatGrams() * FAT_DURATION_HOURS_PER_GRAM
				+ meal.proteinGrams() * PROTEIN_DURATION_HOURS_PER_GRAM) / modifier;
		double total = meal.carbsGrams() + meal.proteinGrams() + meal.fatGrams();
		double carbRatio = meal.carbsGrams() / Math.max(1.0d, total);
		double peak = (BASE_PEAK_HOURS + (1.0d - carbRatio) * BASE_PEAK_HOURS) / modifier;
		return KineticProfile.triangular(0.0d, Math.min(peak, duration), duration);
	}

	public static double effectAt(MealRecord meal, PatientConstants constants, double elapsedHours) {
		return effectAt(carbEquivalent(meal, constants), profileFor(meal, constants),
				constants.absorptionModifier(meal.absorptionClass()), elapsedHours);
	}

	public static double effectAt(double carbEquivalent, KineticProfile profile, double modifier, double elapsedHours) {
		if (!InsulinActionCurve.isWithin(profile, elapsedHours) || !(carbEquivalent > 0)) {
			return 0.0d;
		}
		double peak = profile.riseEndHours();
		double duration = profile.durationHours();
		double fraction;
		if (elapsedHours < peak) {
			fraction = Math.pow(elapsedHours / peak, modifier);
		} else if (duration <= peak) {
			fraction = 1.0d;
		} else {
			double decayed = (elapsedHours - peak) / (duration - peak);
			fraction = Math.pow(Math.max(0.0d, 1.0d - decayed), modifier);
		}
		return carbEquivalent * Math.min(1.0d, fraction);
	}
}
