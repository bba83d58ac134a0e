package my.glucosetimeline.app.dto;

public record NutritionDto(Double carbs, Double protein, Double fat, Double fiber, String absorptionType) {
}
