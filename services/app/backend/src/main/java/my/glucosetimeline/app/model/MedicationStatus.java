package my.glucosetimeline.app.model;

public record MedicationStatus(String id, String medicationId, MedicationEffect effect) {
}
