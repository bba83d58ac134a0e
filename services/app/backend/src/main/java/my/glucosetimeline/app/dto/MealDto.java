package my.glucosetimeline.app.dto;

import java.time.Instant;

public record MealDto(String id, Instant timestamp, NutritionDto nutrition) {
}
