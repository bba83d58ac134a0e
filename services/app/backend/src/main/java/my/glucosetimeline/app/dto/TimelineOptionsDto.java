package my.glucosetimeline.app.dto;

public record TimelineOptionsDto(Boolean gapFillEnabled,
								 Boolean fillFromStart,
								 String extension,
								 Boolean returnToTarget,
								 Integer maxConnectGapMinutes,
								 Double stabilizationHours,
								 Double safetyFloor,
								 String zoneId) {
}
