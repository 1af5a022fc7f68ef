package dev.jobhunter.api;

import dev.jobhunter.settings.PreferenceService;
import dev.jobhunter.settings.Preferences;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final PreferenceService preferenceService;

    @GetMapping
    public Mono<Preferences> get() {
        return Mono.fromCallable(preferenceService::current)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping
    public Mono<Preferences> update(@RequestBody(required = false) Preferences preferences) {
        return Mono.fromCallable(() -> preferenceService.update(preferences))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
