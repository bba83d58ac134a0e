package my.glucosetimeline.app.dto;

import java.time.Instant;

/**
 * A logged dose. {@code takenAt} wins over {@code scheduledTime} when both are present.
 */
public record InsulinDoseDto(String id, String medication, Double dose, Instant takenAt, Instant scheduledTime, String notes) {
}
