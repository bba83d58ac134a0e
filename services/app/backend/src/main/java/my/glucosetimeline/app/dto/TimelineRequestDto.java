package my.glucosetimeline.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

public record TimelineRequestDto(@NotNull @Valid TimeWindowDto window,
								 @NotNull Instant now,
								 List<GlucoseReadingDto> readings,
								 List<InsulinDoseDto> insulinDoses,
								 List<MealDto> meals,
								 List<ActivityDto> activities,
								 List<MedicationCourseDto> medications,
								 @Valid PatientConstantsDto constants,
								 TimelineOptionsDto options) {
}
