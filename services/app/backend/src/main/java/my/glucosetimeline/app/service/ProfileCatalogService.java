package my.glucosetimeline.app.service;

import my.glucosetimeline.app.dto.ProfileDto;
import my.glucosetimeline.app.dto.ProfileResolutionDto;
import my.glucosetimeline.app.kinetics.KineticProfileCatalog;
import my.glucosetimeline.app.kinetics.KineticProfileResolver;
import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.ProfileResolution;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Service
public class ProfileCatalogService {
	private final KineticProfileResolver resolver;

	public ProfileCatalogService(KineticProfileResolver resolver) {
		this.resolver = resolver;
	}

	public List<ProfileDto> listProfiles() {
		return resolver.getCatalog().entries().stream()
				.sorted(Comparator.comparing(KineticProfileCatalog.Entry::id))
				.map(entry -> toDto(entry.id(), entry.category(), entry.description(), entry.profile()))
				.toList();
	}

	public ProfileResolutionDto resolve(String id) {
		ProfileResolution resolution = resolver.resolve(id);
		KineticProfileCatalog.Entry entry = resolver.getCatalog().find(id).orElse(null);
		ProfileDto profile = entry == null
				? toDto(resolution.sourceTypeId(), null, "Default profile", resolution.profile())
				: toDto(entry.id(), entry.category(), entry.description(), entry.profile());
		return new ProfileResolutionDto(id, resolution.fallback(), profile);
	}

	private ProfileDto toDto(String id, String category, String description, KineticProfile profile) {
		return new ProfileDto(id, category, description, profile.shape().name().toLowerCase(Locale.ROOT),
				profile.onsetHours(), profile.peakHours(), profile.durationHours(), profile.durationBased(),
				profile.defaultFactor());
	}
}
