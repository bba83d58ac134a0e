package my.glucosetimeline.app.api;

import jakarta.validation.Valid;
import my.glucosetimeline.app.dto.ActiveEffectsRequestDto;
import my.glucosetimeline.app.dto.EffectPreviewRequestDto;
import my.glucosetimeline.app.model.ActiveEffects;
import my.glucosetimeline.app.model.EffectPreview;
import my.glucosetimeline.app.service.TimelineService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/effects")
public class EffectController {
	private final TimelineService timelineService;

	public EffectController(TimelineService timelineService) {
		this.timelineService = timelineService;
	}

	@PostMapping("/active")
	public ActiveEffects activeEffects(@Valid @RequestBody ActiveEffectsRequestDto request) {
		return timelineService.activeEffects(request);
	}

	@PostMapping("/preview")
	public EffectPreview preview(@Valid @RequestBody EffectPreviewRequestDto request) {
		return timelineService.preview(request);
	}
}
