package my.glucosetimeline.app.model;

public enum PointClassification {
	ACTUAL,
	ESTIMATED_ANCHOR,
	ESTIMATED
}
