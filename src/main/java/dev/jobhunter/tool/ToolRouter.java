package dev.jobhunter.tool;

import dev.jobhunter.entity.JobMatch;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import dev.jobhunter.event.AnalysisEvent;
import dev.jobhunter.event.SessionEventChannel;
import dev.jobhunter.fetch.PageContentFetcher;
import dev.jobhunter.model.JobMatchInput;
import dev.jobhunter.service.MatchStoreService;
import dev.jobhunter.session.AnalysisOrchestrator;
import dev.jobhunter.settings.PreferenceService;
import dev.jobhunter.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Executes decoded tool requests. Storage and settings work runs on the bounded
 * elastic scheduler; page fetches stay non-blocking.
 * <p>
 * Every failure leaves this class as an {@link AnalysisException}; unclassified
 * errors get the tool's fallback kind.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolRouter {

    private final PageContentFetcher fetcher;
    private final PreferenceService preferenceService;
    private final MatchStoreService matchStore;
    private final SessionEventChannel events;
    private final AnalysisOrchestrator orchestrator;
    private final Clock clock;

    public Mono<Object> route(ToolRequest request, ToolCallContext context) {
        ToolName tool = request.tool();
        log.debug("Session {} calls {} (request {})", context.sessionId(), tool.wireName(), context.requestId());

        Mono<Object> result = switch (tool) {
            case SET_QUERY_PARAMS -> blocking(() -> setQueryParams((ToolRequest.SetQueryParams) request, context));
            case FETCH_CONTENT -> {
                ToolRequest.FetchContent fetch = (ToolRequest.FetchContent) request;
                yield fetcher.fetch(fetch.url(), fetch.maxLength()).map(Object.class::cast);
            }
            case RELOAD_PAGE -> blocking(() -> {
                events.publish(AnalysisEvent.reload(clock.instant()));
                return Map.of("ok", true);
            });
            case GET_SETTINGS -> blocking(() -> Map.of("settings", preferenceService.current()));
            case SET_SETTINGS -> blocking(() -> Map.of("settings",
                    preferenceService.update(((ToolRequest.SetSettings) request).settings())));
            case SAVE_JOB_MATCH -> blocking(() -> saveJobMatch((ToolRequest.SaveJobMatch) request, context));
            case LIST_JOB_MATCHES -> blocking(() -> Map.of("matches",
                    matchStore.listRecent(((ToolRequest.ListJobMatches) request).limit())));
            case CLEAR_JOB_MATCHES -> blocking(() -> Map.of("ok", true, "removed", matchStore.clear()));
        };

        return result.onErrorMap(e -> !(e instanceof AnalysisException), e -> {
            log.error("{} failed unexpectedly for session {}: {}", tool.wireName(), context.sessionId(),
                    e.getMessage(), e);
            return new AnalysisException(tool.fallbackKind(),
                    tool.wireName() + " failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()),
                    e);
        });
    }

    private Object setQueryParams(ToolRequest.SetQueryParams request, ToolCallContext context) {
        String url = UrlUtils.requireHttpUrl(request.url(), "url");
        String sessionId = request.sessionId() != null ? request.sessionId() : context.sessionId();
        events.publish(AnalysisEvent.applyQuery(url, sessionId, clock.instant()));
        return Map.of("ok", true);
    }

    private Object saveJobMatch(ToolRequest.SaveJobMatch request, ToolCallContext context) {
        JobMatchInput input = request.match();
        if (input != null && (input.getSessionId() == null || input.getSessionId().isBlank())) {
            input.setSessionId(context.sessionId());
        }
        JobMatch match;
        try {
            match = matchStore.insert(input);
        } catch (AnalysisException e) {
            if (e.getKind() == ErrorKind.PERSIST_FAILED) {
                orchestrator.onPersistFailure(context.session());
            }
            throw e;
        }
        orchestrator.onMatchSaved(context.session(), match);
        return Map.of("match", match);
    }

    private static Mono<Object> blocking(Callable<Object> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
