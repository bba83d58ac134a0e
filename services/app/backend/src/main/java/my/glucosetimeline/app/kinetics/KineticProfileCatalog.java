package my.glucosetimeline.app.kinetics;

import my.glucosetimeline.app.model.KineticProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of known insulin and medication profiles, keyed by normalized id.
 */
public class KineticProfileCatalog {
	private static final Logger logger = LoggerFactory.getLogger(KineticProfileCatalog.class);

	private final Map<String, Entry> entries;

	public KineticProfileCatalog(Collection<Entry> entries) {
		Map<String, Entry> byId = new LinkedHashMap<>();
		if (entries != null) {
			for (Entry entry : entries) {
				byId.put(normalizeId(entry.id()), entry);
			}
		}
		this.entries = Map.copyOf(byId);
	}

	public static KineticProfileCatalog empty() {
		return new KineticProfileCatalog(List.of());
	}

	public static KineticProfileCatalog load(ResourceLoader resourceLoader, String location) {
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			logger.warn("Kinetic profile catalog {} not found, only the default profile is available", location);
			return empty();
		}
		try (InputStream inputStream = resource.getInputStream()) {
			String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			KineticProfileCatalog catalog = fromDefinition(new KineticProfileCatalogParser().parse(content));
			logger.info("Loaded {} kinetic profiles from {}", catalog.size(), location);
			return catalog;
		} catch (Exception ex) {
			logger.warn("Failed to read kinetic profile catalog {}: {}", location, ex.getMessage());
			return empty();
		}
	}

	public static KineticProfileCatalog fromDefinition(KineticProfileCatalogDefinition definition) {
		if (definition == null || definition.getProfiles() == null) {
			return empty();
		}
		List<Entry> parsed = new ArrayList<>();
		for (ProfileDefinition profile : definition.getProfiles()) {
			if (profile == null || profile.getId() == null || profile.getId().isBlank()) {
				logger.warn("Skipping kinetic profile without id");
				continue;
			}
			try {
				parsed.add(new Entry(normalizeId(profile.getId()), profile.getCategory(), profile.getDescription(),
						profile.toKineticProfile()));
			} catch (IllegalArgumentException ex) {
				logger.warn("Skipping kinetic profile {}: {}", profile.getId(), ex.getMessage());
			}
		}
		return new KineticProfileCatalog(parsed);
	}

	public Optional<Entry> find(String id) {
		String key = normalizeId(id);
		if (key.isEmpty()) {
			return Optional.empty();
		}
		return Optional.ofNullable(entries.get(key));
	}

	public List<Entry> entries() {
		return List.copyOf(entries.values());
	}

	public int size() {
		return entries.size();
	}

	/**
	 * Lower-cases and maps spaces and hyphens to underscores, so "Insulin Lispro" finds "insulin_lispro".
	 */
	public static String normalizeId(String id) {
		if (id == null) {
			return "";
		}
		return id.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
	}

	public record Entry(String id, String category, String description, KineticProfile profile) {
	}
}
