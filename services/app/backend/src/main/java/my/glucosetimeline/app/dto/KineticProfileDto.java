package my.glucosetimeline.app.dto;

public record KineticProfileDto(Double onsetHours,
								Double peakHours,
								Double durationHours,
								String shape,
								Boolean durationBased,
								Double factor) {
}
