package my.glucosetimeline.app.model;

import java.time.Instant;
import java.util.Map;

/**
 * Active effect of one category at a timestamp. {@code byId} holds only sources active at {@code at}.
 */
public record EffectAggregate(EffectCategory category, Instant at, double total, Map<String, Double> byId) {
	public EffectAggregate {
		byId = byId == null ? Map.of() : Map.copyOf(byId);
	}

	public static EffectAggregate neutral(EffectCategory category, Instant at) {
		return new EffectAggregate(category, at, category.neutralTotal(), Map.of());
	}
}
