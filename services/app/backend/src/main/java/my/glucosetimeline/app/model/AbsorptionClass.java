package my.glucosetimeline.app.model;

import java.util.Locale;

public enum AbsorptionClass {
	VERY_SLOW("very_slow", 0.6d),
	SLOW("slow", 0.8d),
	MEDIUM("medium", 1.0d),
	FAST("fast", 1.2d),
	VERY_FAST("very_fast", 1.4d);

	private final String id;
	private final double defaultModifier;

	AbsorptionClass(String id, double defaultModifier) {
		this.id = id;
		this.defaultModifier = defaultModifier;
	}

	public String id() {
		return id;
	}

	public double defaultModifier() {
		return defaultModifier;
	}

	public static AbsorptionClass from(String raw) {
		if (raw == null || raw.isBlank()) {
			return MEDIUM;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
		for (AbsorptionClass value : values()) {
			if (value.id.equals(normalized)) {
				return value;
			}
		}
		return MEDIUM;
	}
}
