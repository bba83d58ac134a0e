package my.glucosetimeline.app.model;

/**
 * Raised for a timeline request that cannot be repaired locally, before any computation starts.
 */
public class TimelineConfigurationException extends IllegalArgumentException {
	private final String parameter;

	public TimelineConfigurationException(String parameter, String message) {
		super(message);
		this.parameter = parameter;
	}

	public String getParameter() {
		return parameter;
	}
}
