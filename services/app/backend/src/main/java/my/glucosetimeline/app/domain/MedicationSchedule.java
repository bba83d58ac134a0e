package my.glucosetimeline.app.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Active date range (both ends inclusive) and the times of day a chronic medication is taken.
 */
public record MedicationSchedule(LocalDate startDate,
								 LocalDate endDate,
								 List<LocalTime> dailyTimes) {
	public MedicationSchedule {
		dailyTimes = dailyTimes == null ? List.of() : List.copyOf(dailyTimes);
	}
}
