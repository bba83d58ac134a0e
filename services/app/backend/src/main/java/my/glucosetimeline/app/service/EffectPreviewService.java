package my.glucosetimeline.app.service;

import my.glucosetimeline.app.domain.EffectSource;
import my.glucosetimeline.app.domain.InsulinDose;
import my.glucosetimeline.app.domain.MealRecord;
import my.glucosetimeline.app.kinetics.EffectCurves;
import my.glucosetimeline.app.kinetics.KineticProfileResolver;
import my.glucosetimeline.app.kinetics.ProfileLookup;
import my.glucosetimeline.app.model.CurvePoint;
import my.glucosetimeline.app.model.EffectPreview;
import my.glucosetimeline.app.model.KineticProfile;
import my.glucosetimeline.app.model.PatientConstants;
import my.glucosetimeline.app.model.TimeWindow;
import my.glucosetimeline.app.model.TimelineConfigurationException;
import my.glucosetimeline.app.model.TimelineOptions;
import my.glucosetimeline.app.model.TimelineWarning;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Samples the curve of one insulin dose or meal on a fine grid, from its start to the end of its profile.
 */
@Service
public class EffectPreviewService {
	private final KineticProfileResolver profileResolver;
	private final RecordSanitizer sanitizer;

	public EffectPreviewService(KineticProfileResolver profileResolver, RecordSanitizer sanitizer) {
		this.profileResolver = profileResolver;
		this.sanitizer = sanitizer;
	}

	public EffectPreview preview(EffectSource source, PatientConstants constants, int intervalMinutes) {
		if (!(source instanceof InsulinDose) && !(source instanceof MealRecord)) {
			throw new IllegalArgumentException("Previews are available for insulin doses and meals only");
		}
		if (intervalMinutes <= 0) {
			throw new TimelineConfigurationException("intervalMinutes", "Interval must be positive, was " + intervalMinutes);
		}
		RecordSanitizer.SanitizedInput input = sanitizer.sanitize(List.of(), List.of(source));
		if (input.sources().isEmpty()) {
			throw new IllegalArgumentException(input.warnings().get(0).message());
		}
		PatientConstants resolvedConstants = constants == null ? PatientConstants.defaults() : constants;
		ProfileLookup lookup = new ProfileLookup(profileResolver, resolvedConstants);
		EffectCurves curves = new EffectCurves(lookup, TimelineOptions.defaults().zoneId());
		KineticProfile profile = curves.profileFor(source);
		boolean fallback = source instanceof InsulinDose dose && lookup.resolve(dose.medicationId()).fallback();

		Instant start = source.startsAt();
		Instant end = start.plusMillis(Math.round(profile.durationHours() * 3_600_000.0d));
		TimeWindow window = new TimeWindow(start, end, intervalMinutes);
		List<CurvePoint> raw = new ArrayList<>();
		double peak = 0.0d;
		for (Instant t = window.start(); !t.isAfter(window.end()); t = t.plus(window.interval())) {
			double magnitude = curves.valueAt(source, t);
			peak = Math.max(peak, magnitude);
			raw.add(new CurvePoint(t, EffectCurves.elapsedHours(source, t), magnitude, 0.0d));
		}
		List<CurvePoint> points = new ArrayList<>(raw.size());
		for (CurvePoint point : raw) {
			double percent = peak > 0 ? point.magnitude() / peak * 100.0d : 0.0d;
			points.add(new CurvePoint(point.timestamp(), point.elapsedHours(), point.magnitude(), percent));
		}
		List<TimelineWarning> warnings = lookup.warnings();
		return new EffectPreview(source.id(), source.category(), profile, fallback, peak, points, warnings);
	}

	public EffectPreview preview(EffectSource source, PatientConstants constants) {
		return preview(source, constants, TimeWindow.PREVIEW_INTERVAL_MINUTES);
	}
}
