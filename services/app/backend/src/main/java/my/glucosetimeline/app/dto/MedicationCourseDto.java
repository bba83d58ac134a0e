package my.glucosetimeline.app.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record MedicationCourseDto(String id,
								  String medication,
								  Double factor,
								  LocalDate startDate,
								  LocalDate endDate,
								  List<LocalTime> dailyTimes) {
}
