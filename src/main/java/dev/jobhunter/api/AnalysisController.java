package dev.jobhunter.api;

import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.session.AnalysisOrchestrator;
import dev.jobhunter.session.AnalysisSession;
import dev.jobhunter.session.SessionView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/analyses")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisOrchestrator orchestrator;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<AnalysisStarted> start(@RequestBody(required = false) AnalysisRequest request) {
        return Mono.fromCallable(() -> {
            if (request == null) {
                throw AnalysisException.validation("url is required");
            }
            AnalysisSession session = orchestrator.requestAnalysis(request.url());
            return new AnalysisStarted(session.getId(), orchestrator.toolPort());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public List<SessionView> list() {
        return orchestrator.listSessions().stream()
                .map(AnalysisSession::view)
                .toList();
    }

    @GetMapping("/{id}")
    public SessionView get(@PathVariable("id") String id) {
        return orchestrator.getSession(id).view();
    }

    /**
     * Cancel a session. Blocks for up to the worker grace period, so it runs off the event loop.
     */
    @DeleteMapping("/{id}")
    public Mono<SessionView> cancel(@PathVariable("id") String id) {
        return Mono.fromCallable(() -> orchestrator.cancel(id).view())
                .subscribeOn(Schedulers.boundedElastic());
    }
}
