package my.glucosetimeline.app.dto;

public record ProfileDto(String id,
						 String category,
						 String description,
						 String shape,
						 double onsetHours,
						 Double peakHours,
						 double durationHours,
						 boolean durationBased,
						 double factor) {
}
