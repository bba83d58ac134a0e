package my.glucosetimeline.app.domain;

import my.glucosetimeline.app.model.EffectCategory;

import java.time.Duration;
import java.time.Instant;

/**
 * A bout of activity. {@code level} is signed: negative for sleep and rest, positive for exercise.
 */
public record ActivityRecord(String id,
							 int level,
							 Instant startAt,
							 Instant endAt) implements EffectSource {
	@Override
	public EffectCategory category() {
		return EffectCategory.ACTIVITY;
	}

	@Override
	public Instant startsAt() {
		return startAt;
	}

	public double durationHours() {
		if (startAt == null || endAt == null || endAt.isBefore(startAt)) {
			return 0.0d;
		}
		return Duration.between(startAt, endAt).getSeconds() / 3_600.0d;
	}
}
