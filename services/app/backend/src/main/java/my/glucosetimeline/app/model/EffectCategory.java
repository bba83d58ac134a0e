package my.glucosetimeline.app.model;

/**
 * Additive categories sum per-source magnitudes; multiplicative categories combine per-source multipliers by product.
 */
public enum EffectCategory {
	INSULIN(true),
	CARBOHYDRATE(true),
	ACTIVITY(false),
	MEDICATION(false);

	private final boolean additive;

	EffectCategory(boolean additive) {
		this.additive = additive;
	}

	public boolean isAdditive() {
		return additive;
	}

	public double neutralTotal() {
		return additive ? 0.0d : 1.0d;
	}
}
