package my.glucosetimeline.app.model;

import java.util.Locale;

/**
 * How far estimated points continue past the last anchor.
 */
public enum ExtensionMode {
	NONE,
	TO_NOW,
	TO_WINDOW_END;

	public static ExtensionMode from(String raw, ExtensionMode fallback) {
		if (raw == null || raw.isBlank()) {
			return fallback;
		}
		String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		for (ExtensionMode mode : values()) {
			if (mode.name().equals(normalized)) {
				return mode;
			}
		}
		return fallback;
	}
}
