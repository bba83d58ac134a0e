package my.glucosetimeline.app.model;

import java.util.Locale;

public enum ProfileShape {
	TRIANGULAR,
	PEAKLESS,
	BIPHASIC;

	public static ProfileShape from(String raw, Double peakHours) {
		if (raw == null || raw.isBlank()) {
			return peakHours == null ? PEAKLESS : TRIANGULAR;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		return switch (normalized) {
			case "peakless", "flat", "basal" -> PEAKLESS;
			case "biphasic", "mixed" -> BIPHASIC;
			default -> TRIANGULAR;
		};
	}
}
