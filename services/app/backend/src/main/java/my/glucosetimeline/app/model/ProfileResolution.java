package my.glucosetimeline.app.model;

/**
 * Result of a profile lookup. {@code fallback} marks a degraded lookup that used the default profile.
 */
public record ProfileResolution(String sourceTypeId, KineticProfile profile, boolean fallback) {
}
