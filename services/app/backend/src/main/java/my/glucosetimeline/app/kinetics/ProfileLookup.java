package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.model.PatientConstants;
import my.glucosetimeline.app.model.ProfileResolution;
import my.glucosetimeline.app.model.TimelineWarning;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves each distinct source type once per invocation and records a warning for every fallback.
 * Not thread-safe; create one per computation.
 */
public class ProfileLookup {
	private final KineticProfileResolver resolver;
	private final PatientConstants constants;
	private final Map<String, ProfileResolution> resolved = new HashMap<>();
	private final List<TimelineWarning> warnings = new ArrayList<>();

	public ProfileLookup(KineticProfileResolver resolver, PatientConstants constants) {
		this.resolver = resolver;
		this.constants = constants;
	}

	public ProfileResolution resolve(String sourceTypeId) {
		String key = KineticProfileCatalog.normalizeId(sourceTypeId);
		ProfileResolution existing = resolved.get(key);
		if (existing != null) {
			return existing;
		}
		ProfileResolution resolution = resolver.resolve(sourceTypeId, constants);
		resolved.put(key, resolution);
		if (resolution.fallback()) {
			warnings.add(new TimelineWarning(TimelineWarning.Type.MISSING_PROFILE, sourceTypeId,
					"Unknown source type '" + sourceTypeId + "', default kinetic profile applied"));
		}
		return resolution;
	}

	public PatientConstants constants() {
		return constants;
	}

	public int resolvedCount() {
		return resolved.size();
	}

	public List<TimelineWarning> warnings() {
		return List.copyOf(warnings);
	}
}
