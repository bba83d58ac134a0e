package my.glucosetimeline.app.domain;

import my.glucosetimeline.app.model.AbsorptionClass;
import my.glucosetimeline.app.model.EffectCategory;

import java.time.Instant;

public record MealRecord(String id,
						 double carbsGrams,
						 double proteinGrams,
						 double fatGrams,
						 double fiberGrams,
						 AbsorptionClass absorptionClass,
						 Instant occurredAt) implements EffectSource {
	public MealRecord(String id,
					  double carbsGrams,
					  double proteinGrams,
					  double fatGrams,
					  AbsorptionClass absorptionClass,
					  Instant occurredAt) {
		this(id, carbsGrams, proteinGrams, fatGrams, 0.0d, absorptionClass, occurredAt);
	}

	@Override
	public EffectCategory category() {
		return EffectCategory.CARBOHYDRATE;
	}

	@Override
	public Instant startsAt() {
		return occurredAt;
	}
}
