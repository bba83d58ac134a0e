package my.glucosetimeline.app.model;

/**
 * Timing parameters of an effect source.
 *
 * @param onsetHours      time until the source begins acting
 * @param peakHours       time of maximal effect, null for peakless profiles
 * @param durationHours   total time of activity; every curve is zero past this point
 * @param shape           curve family, tagged explicitly rather than inferred from {@code peakHours}
 * @param durationBased   false for chronic medications whose factor is constant while the course is active
 * @param defaultFactor   steady-state insulin-needs factor for medications, 1.0 for everything else
 */
public record KineticProfile(double onsetHours,
							 Double peakHours,
							 double durationHours,
							 ProfileShape shape,
							 boolean durationBased,
							 double defaultFactor) {
	public static final KineticProfile DEFAULT = new KineticProfile(0.5d, 2.0d, 4.0d, ProfileShape.TRIANGULAR, true, 1.0d);

	public KineticProfile {
		if (shape == null) {
			shape = peakHours == null ? ProfileShape.PEAKLESS : ProfileShape.TRIANGULAR;
		}
		if (!Double.isFinite(onsetHours) || !Double.isFinite(durationHours)) {
			throw new IllegalArgumentException("Profile hours must be finite");
		}
		if (onsetHours < 0 || durationHours < 0) {
			throw new IllegalArgumentException("Profile hours must not be negative");
		}
		if (peakHours != null && (!Double.isFinite(peakHours) || peakHours < onsetHours || peakHours > durationHours)) {
			throw new IllegalArgumentException("Peak must lie between onset and duration");
		}
		if (onsetHours > durationHours) {
			throw new IllegalArgumentException("Onset must not exceed duration");
		}
		if (shape != ProfileShape.PEAKLESS && peakHours == null) {
			throw new IllegalArgumentException("Shape " + shape + " requires a peak");
		}
	}

	public static KineticProfile triangular(double onsetHours, double peakHours, double durationHours) {
		return new KineticProfile(onsetHours, peakHours, durationHours, ProfileShape.TRIANGULAR, true, 1.0d);
	}

	public static KineticProfile peakless(double onsetHours, double durationHours) {
		return new KineticProfile(onsetHours, null, durationHours, ProfileShape.PEAKLESS, true, 1.0d);
	}

	public boolean isPeakless() {
		return shape == ProfileShape.PEAKLESS;
	}

	/**
	 * End of the rising phase: the peak, or the onset for peakless profiles.
	 */
	public double riseEndHours() {
		return peakHours == null ? onsetHours : peakHours;
	}
}
