package my.glucosetimeline.app.model;

import java.util.List;

public record TimelineResult(List<TimelinePoint> points, TimelineSummary summary, List<TimelineWarning> warnings) {
	public TimelineResult {
		points = points == null ? List.of() : List.copyOf(points);
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}

	public boolean isEmpty() {
		return points.isEmpty();
	}
}
