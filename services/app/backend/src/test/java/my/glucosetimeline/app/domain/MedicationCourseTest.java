package my.glucosetimeline.app.domain;

import my.glucosetimeline.app.model.EffectCategory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MedicationCourseTest {
	@Test
	void startsAtUtcMidnightOfFirstDay() {
		MedicationCourse course = new MedicationCourse("met", "metformin", null,
				new MedicationSchedule(LocalDate.of(2026, 3, 1), null, List.of()));

		assertThat(course.category()).isEqualTo(EffectCategory.MEDICATION);
		assertThat(course.startsAt()).isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
	}

	@Test
	void hasNoStartWithoutSchedule() {
		assertThat(new MedicationCourse("met", "metformin", null, null).startsAt()).isNull();
	}
}
