package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.domain.ActivityRecord;
import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.PatientConstants;

/**
 * Intensity of an activity's influence on insulin needs, and the multiplier it implies.
 * <p>
 * During the activity the intensity ramps from 0.2 to 1.0 with the elapsed fraction. Afterwards it
 * decays linearly to 0 over an effect duration that grows with the activity length and level, capped at 24h.
 */
public final class ActivityImpactCurve {
	private static final double START_INTENSITY = 0.2d;
	private static final double MIN_ACTIVITY_HOURS = 0.1d;
	private static final double BASE_EFFECT_HOURS = 2.0d;
	private static final double LEVEL_EFFECT_WEIGHT = 0.2d;
	private static final double MAX_EFFECT_HOURS = 24.0d;

	private ActivityImpactCurve() {
	}

	public static double effectDurationHours(ActivityRecord activity) {
		double extended = BASE_EFFECT_HOURS
				+ activity.durationHours() * (1.0d + Math.abs(activity.level()) * LEVEL_EFFECT_WEIGHT);
		return Math.min(MAX_EFFECT_HOURS, extended);
	}

	/**
	 * Onset at the start, peak at the end of the activity, zero once the after-effect has faded.
	 */
	public static KineticProfile profileFor(ActivityRecord activity) {
		double activityHours = activity.durationHours();
		return KineticProfile.triangular(0.0d, activityHours, activityHours + effectDurationHours(activity));
	}

	public static double intensityAt(ActivityRecord activity, double elapsedHours) {
		KineticProfile profile = profileFor(activity);
		if (!InsulinActionCurve.isWithin(profile, elapsedHours)) {
			return 0.0d;
		}
		double activityHours = activity.durationHours();
		if (elapsedHours <= activityHours) {
			double progress = elapsedHours / Math.max(activityHours, MIN_ACTIVITY_HOURS);
			return Math.min(1.0d, START_INTENSITY + (1.0d - START_INTENSITY) * progress);
		}
		double sinceEnd = elapsedHours - activityHours;
		return Math.max(0.0d, 1.0d - sinceEnd / effectDurationHours(activity));
	}

	/**
	 * Insulin-needs multiplier relative to 1.0. Exercise lowers it, sleep and rest raise it.
	 */
	public static double multiplierAt(ActivityRecord activity, PatientConstants constants, double elapsedHours) {
		double intensity = intensityAt(activity, elapsedHours);
		if (intensity == 0.0d) {
			return 1.0d;
		}
		return Math.max(0.0d, 1.0d + constants.activityCoefficient(activity.level()) * intensity);
	}
}
