package my.glucosetimeline.app.config;

import my.glucosetimeline.app.kinetics.KineticProfileCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class KineticsConfig {
	static final String DEFAULT_CATALOG_LOCATION = "classpath:kinetic_profiles.yml";

	@Bean
	public KineticProfileCatalog kineticProfileCatalog(ResourceLoader resourceLoader, AppProperties properties) {
		String location = properties.kinetics() == null ? null : properties.kinetics().catalogLocation();
		if (location == null || location.isBlank()) {
			location = DEFAULT_CATALOG_LOCATION;
		}
		return KineticProfileCatalog.load(resourceLoader, location);
	}
}
