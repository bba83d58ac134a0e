package my.glucosetimeline.app.api;

import jakarta.validation.Valid;
import my.glucosetimeline.app.dto.TimelineRequestDto;
import my.glucosetimeline.app.model.TimelineResult;
import my.glucosetimeline.app.service.TimelineService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/timeline")
public class TimelineController {
	private final TimelineService timelineService;

	public TimelineController(TimelineService timelineService) {
		this.timelineService = timelineService;
	}

	@PostMapping
	public TimelineResult buildTimeline(@Valid @RequestBody TimelineRequestDto request) {
		return timelineService.buildTimeline(request);
	}
}
