package my.glucosetimeline.app.dto;

import java.time.Instant;

public record ActivityDto(String id, Integer level, Instant startTime, Instant endTime) {
}
