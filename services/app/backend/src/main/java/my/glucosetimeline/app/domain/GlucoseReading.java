package my.glucosetimeline.app.domain;

import java.time.Instant;

/**
 * A measured glucose value. The engine never alters readings; they are emitted as-is.
 */
public record GlucoseReading(Instant timestamp, double value, ReadingSource source) {
}
