package my.glucosetimeline.app.service;

import my.glucosetimeline.app.domain.EffectSource;
import my.glucosetimeline.app.kinetics.EffectCurves;
import my.glucosetimeline.app.model.EffectAggregate;
import my.glucosetimeline.app.model.EffectCategory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the per-source curve values of one category at a timestamp. Additive categories sum their
 * magnitudes, multiplicative categories multiply their factors. Inactive sources are left out of the breakdown.
 */
@Component
public class ActiveEffectAggregator {
	private static final double MIN_INSULIN_NEEDS_FACTOR = 0.1d;

	public EffectAggregate aggregate(List<EffectSource> sources, EffectCategory category, Instant at, EffectCurves curves) {
		if (sources == null || sources.isEmpty() || at == null) {
			return EffectAggregate.neutral(category, at);
		}
		Map<String, Double> byId = new LinkedHashMap<>();
		double total = category.neutralTotal();
		for (EffectSource source : sources) {
			if (source.category() != category || !curves.isActive(source, at)) {
				continue;
			}
			double value = Math.max(0.0d, curves.valueAt(source, at));
			if (category.isAdditive()) {
				total += value;
				byId.merge(source.id(), value, Double::sum);
			} else {
				total *= value;
				byId.merge(source.id(), value, (left, right) -> left * right);
			}
		}
		return new EffectAggregate(category, at, Math.max(0.0d, total), byId);
	}

	/**
	 * Product of the activity and medication multipliers, floored so insulin impact stays bounded.
	 */
	public double insulinNeedsFactor(List<EffectSource> sources, Instant at, EffectCurves curves) {
		double activity = aggregate(sources, EffectCategory.ACTIVITY, at, curves).total();
		double medication = aggregate(sources, EffectCategory.MEDICATION, at, curves).total();
		return Math.max(MIN_INSULIN_NEEDS_FACTOR, activity * medication);
	}
}
