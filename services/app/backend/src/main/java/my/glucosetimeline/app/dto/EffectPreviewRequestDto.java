package my.glucosetimeline.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;

/**
 * Exactly one of {@code insulinDose} and {@code meal} must be set.
 */
public record EffectPreviewRequestDto(InsulinDoseDto insulinDose,
									  MealDto meal,
									  @Valid PatientConstantsDto constants,
									  @Positive Integer intervalMinutes) {
}
