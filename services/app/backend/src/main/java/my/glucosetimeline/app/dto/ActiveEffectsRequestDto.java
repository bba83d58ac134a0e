package my.glucosetimeline.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

public record ActiveEffectsRequestDto(@NotNull Instant at,
									  List<InsulinDoseDto> insulinDoses,
									  List<MealDto> meals,
									  List<ActivityDto> activities,
									  List<MedicationCourseDto> medications,
									  @Valid PatientConstantsDto constants,
									  String zoneId) {
}
