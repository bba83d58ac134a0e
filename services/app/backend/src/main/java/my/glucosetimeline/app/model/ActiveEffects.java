package my.glucosetimeline.app.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything acting on glucose at one moment: insulin on board, carbohydrate equivalent on board,
 * the activity and medication multipliers and their combined insulin-needs factor.
 */
public record ActiveEffects(Instant at,
							EffectAggregate insulin,
							EffectAggregate carbohydrate,
							EffectAggregate activity,
							EffectAggregate medication,
							double insulinNeedsFactor,
							List<MedicationStatus> medications,
							List<TimelineWarning> warnings) {
	public ActiveEffects {
		medications = medications == null ? List.of() : List.copyOf(medications);
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}
}
