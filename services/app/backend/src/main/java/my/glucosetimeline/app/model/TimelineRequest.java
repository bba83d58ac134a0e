package my.glucosetimeline.app.model;

import my.glucosetimeline.app.domain.EffectSource;
import my.glucosetimeline.app.domain.GlucoseReading;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable input snapshot of one reconstruction. {@code now} separates history from projection.
 * Null entries in the record lists are kept so the sanitizer can report them.
 */
public record TimelineRequest(TimeWindow window,
							  Instant now,
							  List<GlucoseReading> readings,
							  List<EffectSource> sources,
							  PatientConstants constants,
							  TimelineOptions options) {
	public TimelineRequest {
		readings = readings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(readings));
		sources = sources == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(sources));
		if (constants == null) {
			constants = PatientConstants.defaults();
		}
		if (options == null) {
			options = TimelineOptions.defaults();
		}
	}
}
