package my.glucosetimeline.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Timeline timeline,
		@Valid PatientDefaults patientDefaults,
		Kinetics kinetics
) {
	public record Timeline(
			@Positive Integer intervalMinutes,
			@Positive Integer previewIntervalMinutes,
			@PositiveOrZero Integer maxConnectGapMinutes,
			@Positive Double stabilizationHours,
			Double safetyFloor,
			Boolean gapFillEnabled,
			Boolean fillFromStart,
			String extension,
			Boolean returnToTarget,
			String zoneId
	) {
	}

	public record PatientDefaults(
			@Positive Double targetGlucose,
			@Positive Double correctionFactor,
			@Positive Double insulinSensitivityFactor,
			@PositiveOrZero Double carbToBgFactor,
			@PositiveOrZero Double proteinFactor,
			@PositiveOrZero Double fatFactor,
			@PositiveOrZero Double fiberFactor
	) {
	}

	public record Kinetics(
			String catalogLocation
	) {
	}
}
