package my.glucosetimeline.app.model;

public enum MedicationPhase {
	NOT_STARTED,
	ENDED,
	RAMPING_UP,
	PEAK,
	TAPERING,
	NO_EFFECT,
	CONSTANT
}
