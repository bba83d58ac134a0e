package my.glucosetimeline.app.domain;

import java.util.Locale;

public enum ReadingSource {
	MANUAL,
	SENSOR;

	public static ReadingSource from(String raw) {
		if (raw == null || raw.isBlank()) {
			return MANUAL;
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT);
		if (normalized.equals("sensor") || normalized.equals("cgm") || normalized.equals("import")) {
			return SENSOR;
		}
		return MANUAL;
	}
}
