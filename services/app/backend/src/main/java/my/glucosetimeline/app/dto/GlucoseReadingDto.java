package my.glucosetimeline.app.dto;

import java.time.Instant;

public record GlucoseReadingDto(Instant timestamp, Double value, String source) {
}
