package my.glucosetimeline.app.model;

public record TimelineWarning(Type type, String sourceId, String message) {
	public enum Type {
		MISSING_PROFILE,
		INVALID_RECORD,
		EMPTY_INPUT
	}
}
