package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.model.KineticProfile;

/**
 * Active insulin units still acting at a given elapsed time. Zero outside {@code [0, duration]}.
 */
public final class InsulinActionCurve {
	private static final double PEAKLESS_PLATEAU = 0.5d;

	private InsulinActionCurve() {
	}

	public static double effectAt(double units, KineticProfile profile, double elapsedHours) {
		if (!isWithin(profile, elapsedHours) || !(units > 0)) {
			return 0.0d;
		}
		return switch (profile.shape()) {
			case PEAKLESS -> units * peaklessScale(profile, elapsedHours);
			case BIPHASIC -> units * (triangularScale(profile, elapsedHours) + peaklessScale(profile, elapsedHours)) / 2.0d;
			case TRIANGULAR -> units * triangularScale(profile, elapsedHours);
		};
	}

	/**
	 * 0..1 scale: eases in until onset, rises linearly to 1.0 at the peak, falls linearly to 0 at the duration.
	 */
	static double triangularScale(KineticProfile profile, double elapsedHours) {
		double onset = profile.onsetHours();
		double peak = profile.riseEndHours();
		double duration = profile.durationHours();
		if (elapsedHours < onset) {
			// onset-weighted: e^2 / (onset * peak) meets e / peak at the onset
			return elapsedHours * elapsedHours / (onset * peak);
		}
		if (elapsedHours < peak) {
			return elapsedHours / peak;
		}
		if (duration <= peak) {
			return 1.0d;
		}
		return clamp(1.0d - (elapsedHours - peak) / (duration - peak));
	}

	/**
	 * 0..0.5 scale: ramps to half strength at onset, then decays linearly to 0 at the duration.
	 */
	static double peaklessScale(KineticProfile profile, double elapsedHours) {
		double onset = profile.onsetHours();
		double duration = profile.durationHours();
		if (elapsedHours < onset) {
			return (elapsedHours / onset) * PEAKLESS_PLATEAU;
		}
		if (duration <= onset) {
			return PEAKLESS_PLATEAU;
		}
		return clamp(PEAKLESS_PLATEAU * (1.0d - (elapsedHours - onset) / (duration - onset)));
	}

	static boolean isWithin(KineticProfile profile, double elapsedHours) {
		return profile != null && Double.isFinite(elapsedHours) && elapsedHours >= 0
				&& elapsedHours <= profile.durationHours();
	}

	private static double clamp(double value) {
		return Math.max(0.0d, Math.min(1.0d, value));
	}
}
