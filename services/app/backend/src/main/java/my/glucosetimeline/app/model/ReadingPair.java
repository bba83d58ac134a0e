package my.glucosetimeline.app.model;

import my.glucosetimeline.app.domain.GlucoseReading;

public record ReadingPair(GlucoseReading previous, GlucoseReading next, double gapMinutes, boolean connectable) {
}
