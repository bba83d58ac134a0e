package my.glucosetimeline.app.kinetics;

import java.util.List;

public class KineticProfileCatalogDefinition {
	private int schemaVersion;
	private List<ProfileDefinition> profiles;

	public int getSchemaVersion() {
		return schemaVersion;
	}

	public void setSchemaVersion(int schemaVersion) {
		this.schemaVersion = schemaVersion;
	}

	public List<ProfileDefinition> getProfiles() {
		return profiles;
	}

	public void setProfiles(List<ProfileDefinition> profiles) {
		this.profiles = profiles;
	}
}
