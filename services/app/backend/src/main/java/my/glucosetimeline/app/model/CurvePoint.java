package my.glucosetimeline.app.model;

import java.time.Instant;

/**
 * @param activityPercent magnitude relative to the curve's peak magnitude, 0..100
 */
public record CurvePoint(Instant timestamp, double elapsedHours, double magnitude, double activityPercent) {
}
