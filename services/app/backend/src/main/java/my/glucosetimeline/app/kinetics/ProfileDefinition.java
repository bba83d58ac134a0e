package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.ProfileShape;

/**
 * One catalog entry as written in {@code kinetic_profiles.yml}.
 */
public class ProfileDefinition {
	private String id;
	private String category;
	private String description;
	private String shape;
	private Double onsetHours;
	private Double peakHours;
	private Double durationHours;
	private Boolean durationBased;
	private Double factor;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public String getCategory() {
		return category;
	}

	public void setCategory(String category) {
		this.category = category;
	}

	public String getDescription() {
		return description;
	}

	public void setDescription(String description) {
		this.description = description;
	}

	public String getShape() {
		return shape;
	}

	public void setShape(String shape) {
		this.shape = shape;
	}

	public Double getOnsetHours() {
		return onsetHours;
	}

	public void setOnsetHours(Double onsetHours) {
		this.onsetHours = onsetHours;
	}

	public Double getPeakHours() {
		return peakHours;
	}

	public void setPeakHours(Double peakHours) {
		this.peakHours = peakHours;
	}

	public Double getDurationHours() {
		return durationHours;
	}

	public void setDurationHours(Double durationHours) {
		this.durationHours = durationHours;
	}

	public Boolean getDurationBased() {
		return durationBased;
	}

	public void setDurationBased(Boolean durationBased) {
		this.durationBased = durationBased;
	}

	public Double getFactor() {
		return factor;
	}

	public void setFactor(Double factor) {
		this.factor = factor;
	}

	/**
	 * Converts the entry, rejecting timings that break the onset/peak/duration ordering.
	 * Entries that are not duration based may omit every timing field.
	 */
	public KineticProfile toKineticProfile() {
		boolean timed = durationBased == null || durationBased;
		double onset = onsetHours == null ? 0.0d : onsetHours;
		double duration = durationHours == null ? 0.0d : durationHours;
		if (timed && durationHours == null) {
			throw new IllegalArgumentException("Profile " + id + " is duration based but has no duration_hours");
		}
		ProfileShape resolvedShape = ProfileShape.from(shape, peakHours);
		Double peak = resolvedShape == ProfileShape.PEAKLESS ? null : peakHours;
		double steadyFactor = factor == null ? 1.0d : factor;
		if (!Double.isFinite(steadyFactor) || steadyFactor <= 0) {
			throw new IllegalArgumentException("Profile " + id + " has a non-positive factor");
		}
		return new KineticProfile(onset, peak, duration, resolvedShape, timed, steadyFactor);
	}
}
