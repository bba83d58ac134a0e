package my.glucosetimeline.app.api;

import my.glucosetimeline.app.dto.ProfileDto;
import my.glucosetimeline.app.dto.ProfileResolutionDto;
import my.glucosetimeline.app.service.ProfileCatalogService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/profiles")
public class ProfileController {
	private final ProfileCatalogService profileCatalogService;

	public ProfileController(ProfileCatalogService profileCatalogService) {
		this.profileCatalogService = profileCatalogService;
	}

	@GetMapping
	public List<ProfileDto> listProfiles() {
		return profileCatalogService.listProfiles();
	}

	@GetMapping("/{id}")
	public ProfileResolutionDto resolveProfile(@PathVariable("id") String id) {
		return profileCatalogService.resolve(id);
	}
}
