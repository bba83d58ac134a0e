package my.glucosetimeline.app.dto;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record TimeWindowDto(@NotNull Instant start, @NotNull Instant end, Integer intervalMinutes) {
}
