package my.glucosetimeline.app.service;

import my.glucosetimeline.app.domain.GlucoseReading;
import my.glucosetimeline.app.kinetics.EffectCurves;
import my.glucosetimeline.app.model.ReadingPair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Marks consecutive actual readings as one continuous segment when their gap is within the threshold.
 */
@Component
public class ReadingConnectivity {
	public List<ReadingPair> classify(List<GlucoseReading> readings, int maxConnectGapMinutes) {
		if (readings == null || readings.size() < 2) {
			return List.of();
		}
		List<GlucoseReading> sorted = readings.stream()
				.sorted(Comparator.comparing(GlucoseReading::timestamp))
				.toList();
		List<ReadingPair> pairs = new ArrayList<>(sorted.size() - 1);
		for (int i = 1; i < sorted.size(); i++) {
			GlucoseReading previous = sorted.get(i - 1);
			GlucoseReading next = sorted.get(i);
			double gapMinutes = gapMinutes(previous, next);
			pairs.add(new ReadingPair(previous, next, gapMinutes, gapMinutes <= maxConnectGapMinutes));
		}
		return pairs;
	}

	private double gapMinutes(GlucoseReading previous, GlucoseReading next) {
		return Math.abs(EffectCurves.hoursBetween(previous.timestamp(), next.timestamp())) * 60.0d;
	}
}
