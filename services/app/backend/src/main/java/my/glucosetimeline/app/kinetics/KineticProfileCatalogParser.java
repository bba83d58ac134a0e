package my.glucosetimeline.app.kinetics;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

public class KineticProfileCatalogParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public KineticProfileCatalogParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();

		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public KineticProfileCatalogDefinition parse(String content) throws Exception {
		String trimmed = content == null ? "" : content.trim();
		if (trimmed.startsWith("{")) {
			return jsonMapper.readValue(trimmed, KineticProfileCatalogDefinition.class);
		}
		return yamlMapper.readValue(content, KineticProfileCatalogDefinition.class);
	}
}
