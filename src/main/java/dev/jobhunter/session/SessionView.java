package dev.jobhunter.session;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Point-in-time copy of a session for callers outside the orchestrator.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionView(
        String sessionId,
        String url,
        SessionState state,
        FailureReason failureReason,
        String matchId,
        Instant createdAt,
        Instant lastActivityAt,
        Instant finishedAt) {
}
