package my.glucosetimeline.app.domain;

import my.glucosetimeline.app.model.EffectCategory;

import java.time.Instant;

public record InsulinDose(String id,
						  String medicationId,
						  double units,
						  Instant administeredAt) implements EffectSource {
	@Override
	public EffectCategory category() {
		return EffectCategory.INSULIN;
	}

	@Override
	public Instant startsAt() {
		return administeredAt;
	}
}
