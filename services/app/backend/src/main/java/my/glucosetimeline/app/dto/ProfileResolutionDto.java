package my.glucosetimeline.app.dto;

public record ProfileResolutionDto(String requestedId, boolean fallback, ProfileDto profile) {
}
