package dev.jobhunter.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.jobhunter.session.FailureReason;

import java.time.Instant;

/**
 * Typed payload published on the {@link SessionEventChannel}.
 * Fields that do not apply to an event type are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisEvent(
        EventType type,
        String sessionId,
        String url,
        String matchId,
        FailureReason reason,
        Instant timestamp) {

    public static AnalysisEvent started(String sessionId, String url, Instant at) {
        return new AnalysisEvent(EventType.STARTED, sessionId, url, null, null, at);
    }

    public static AnalysisEvent running(String sessionId, Instant at) {
        return new AnalysisEvent(EventType.RUNNING, sessionId, null, null, null, at);
    }

    public static AnalysisEvent completed(String sessionId, String matchId, Instant at) {
        return new AnalysisEvent(EventType.COMPLETED, sessionId, null, matchId, null, at);
    }

    public static AnalysisEvent failed(String sessionId, FailureReason reason, Instant at) {
        return new AnalysisEvent(EventType.FAILED, sessionId, null, null, reason, at);
    }

    public static AnalysisEvent matchSaved(String sessionId, String matchId, Instant at) {
        return new AnalysisEvent(EventType.MATCH_SAVED, sessionId, null, matchId, null, at);
    }

    public static AnalysisEvent applyQuery(String url, String sessionId, Instant at) {
        return new AnalysisEvent(EventType.APPLY_QUERY, sessionId, url, null, null, at);
    }

    public static AnalysisEvent reload(Instant at) {
        return new AnalysisEvent(EventType.RELOAD, null, null, null, null, at);
    }
}
