package dev.jobhunter.api;

import dev.jobhunter.entity.JobMatch;
import dev.jobhunter.service.MatchStoreService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/matches")
@RequiredArgsConstructor
public class MatchController {

    private final MatchStoreService matchStore;

    @GetMapping
    public Mono<List<JobMatch>> list(
            @RequestParam(name = "limit", defaultValue = "" + MatchStoreService.DEFAULT_LIST_LIMIT) int limit) {
        return Mono.fromCallable(() -> matchStore.listRecent(limit))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping
    public Mono<Map<String, Integer>> clear() {
        return Mono.fromCallable(() -> Map.of("removed", matchStore.clear()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
