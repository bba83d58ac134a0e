package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.PatientConstants;
import my.glucosetimeline.app.model.ProfileResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Maps a source type id to its kinetic profile. Never fails: unknown ids resolve to
 * {@link KineticProfile#DEFAULT} with the fallback flag set.
 */
@Service
public class KineticProfileResolver {
	private static final Logger logger = LoggerFactory.getLogger(KineticProfileResolver.class);

	private final KineticProfileCatalog catalog;

	public KineticProfileResolver(KineticProfileCatalog catalog) {
		this.catalog = catalog;
	}

	public ProfileResolution resolve(String sourceTypeId) {
		return resolve(sourceTypeId, null);
	}

	/**
	 * Patient-supplied medication factors take precedence over catalog entries with the same id.
	 */
	public ProfileResolution resolve(String sourceTypeId, PatientConstants constants) {
		String key = KineticProfileCatalog.normalizeId(sourceTypeId);
		if (constants != null) {
			KineticProfile override = findOverride(key, constants.medicationFactors());
			if (override != null) {
				return new ProfileResolution(key, override, false);
			}
		}
		return catalog.find(key)
				.map(entry -> new ProfileResolution(key, entry.profile(), false))
				.orElseGet(() -> {
					logger.warn("No kinetic profile for '{}', using default profile", sourceTypeId);
					return new ProfileResolution(key, KineticProfile.DEFAULT, true);
				});
	}

	public KineticProfileCatalog getCatalog() {
		return catalog;
	}

	private KineticProfile findOverride(String key, Map<String, KineticProfile> overrides) {
		if (key.isEmpty() || overrides == null || overrides.isEmpty()) {
			return null;
		}
		for (Map.Entry<String, KineticProfile> entry : overrides.entrySet()) {
			if (key.equals(KineticProfileCatalog.normalizeId(entry.getKey())) && entry.getValue() != null) {
				return entry.getValue();
			}
		}
		return null;
	}
}
