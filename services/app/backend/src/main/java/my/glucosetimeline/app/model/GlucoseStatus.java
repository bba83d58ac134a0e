package my.glucosetimeline.app.model;

public enum GlucoseStatus {
	LOW,
	NORMAL,
	HIGH;

	private static final double LOW_RATIO = 0.7d;
	private static final double HIGH_RATIO = 1.3d;

	public static GlucoseStatus classify(double value, double targetGlucose) {
		if (value < targetGlucose * LOW_RATIO) {
			return LOW;
		}
		if (value > targetGlucose * HIGH_RATIO) {
			return HIGH;
		}
		return NORMAL;
	}
}
