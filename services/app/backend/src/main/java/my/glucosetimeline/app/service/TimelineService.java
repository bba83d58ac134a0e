package my.glucosetimeline.app.service;

import my.glucosetimeline.app.config.TimelineDefaults;
import my.glucosetimeline.app.domain.EffectSource;
import my.glucosetimeline.app.dto.ActiveEffectsRequestDto;
import my.glucosetimeline.app.dto.EffectPreviewRequestDto;
import my.glucosetimeline.app.dto.TimelineRequestDto;
import my.glucosetimeline.app.model.ActiveEffects;
import my.glucosetimeline.app.model.EffectPreview;
import my.glucosetimeline.app.model.PatientConstants;
import my.glucosetimeline.app.model.TimelineRequest;
import my.glucosetimeline.app.model.TimelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TimelineService {
	private static final Logger logger = LoggerFactory.getLogger(TimelineService.class);

	private final TimelineDefaults defaults;
	private final TimelineRequestMapper mapper;
	private final TimelineReconciliationEngine engine;
	private final EffectPreviewService previewService;

	public TimelineService(TimelineDefaults defaults,
						   TimelineRequestMapper mapper,
						   TimelineReconciliationEngine engine,
						   EffectPreviewService previewService) {
		this.defaults = defaults;
		this.mapper = mapper;
		this.engine = engine;
		this.previewService = previewService;
	}

	public TimelineResult buildTimeline(TimelineRequestDto dto) {
		TimelineRequest request = new TimelineRequest(
				mapper.toWindow(dto.window(), defaults.intervalMinutes()),
				dto.now(),
				mapper.toReadings(dto.readings()),
				mapper.toSources(dto.insulinDoses(), dto.meals(), dto.activities(), dto.medications()),
				mapper.mergeConstants(dto.constants(), defaults.constants()),
				mapper.mergeOptions(dto.options(), defaults.options())
		);
		logger.debug("Timeline request with {} readings and {} effect sources",
				request.readings().size(), request.sources().size());
		return engine.reconstruct(request);
	}

	public ActiveEffects activeEffects(ActiveEffectsRequestDto dto) {
		PatientConstants constants = mapper.mergeConstants(dto.constants(), defaults.constants());
		return engine.activeEffectsAt(
				mapper.toSources(dto.insulinDoses(), dto.meals(), dto.activities(), dto.medications()),
				constants,
				mapper.zoneOr(dto.zoneId(), defaults.options().zoneId()),
				dto.at());
	}

	public EffectPreview preview(EffectPreviewRequestDto dto) {
		if ((dto.insulinDose() == null) == (dto.meal() == null)) {
			throw new IllegalArgumentException("Exactly one of insulinDose or meal is required");
		}
		EffectSource source = dto.insulinDose() != null
				? mapper.toInsulinDose(dto.insulinDose(), 1)
				: mapper.toMeal(dto.meal(), 1);
		int interval = dto.intervalMinutes() == null ? defaults.previewIntervalMinutes() : dto.intervalMinutes();
		return previewService.preview(source, mapper.mergeConstants(dto.constants(), defaults.constants()), interval);
	}
}
