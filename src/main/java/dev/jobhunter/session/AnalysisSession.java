package dev.jobhunter.session;

import java.time.Instant;

/**
 * One end-to-end analysis run for a single URL.
 * <p>
 * Mutated only through the orchestrator. Terminal transitions happen at most once;
 * after that the session is immutable.
 */
public class AnalysisSession {

    private final String id;
    private final String url;
    private final Instant createdAt;

    private SessionState state = SessionState.STARTED;
    private FailureReason failureReason;
    private String matchId;
    private Instant lastActivityAt;
    private Instant finishedAt;
    private boolean workerAttached;

    public AnalysisSession(String id, String url, Instant createdAt) {
        this.id = id;
        this.url = url;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized FailureReason getFailureReason() {
        return failureReason;
    }

    public synchronized String getMatchId() {
        return matchId;
    }

    public synchronized Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized boolean isActive() {
        return state.isActive();
    }

    /**
     * Record tool activity.
     *
     * @return true if this call moved the session from STARTED to RUNNING
     */
    synchronized boolean markActivity(Instant at) {
        if (!state.isActive()) {
            return false;
        }
        lastActivityAt = at;
        if (state == SessionState.STARTED) {
            state = SessionState.RUNNING;
            return true;
        }
        return false;
    }

    /**
     * Claim the session for a worker connection. Only one connection may hold it.
     */
    synchronized boolean attachWorker() {
        if (!state.isActive() || workerAttached) {
            return false;
        }
        workerAttached = true;
        return true;
    }

    synchronized void detachWorker() {
        workerAttached = false;
    }

    synchronized void linkMatch(String id) {
        if (state.isActive()) {
            matchId = id;
        }
    }

    synchronized boolean complete(Instant at) {
        if (!state.isActive()) {
            return false;
        }
        state = SessionState.COMPLETED;
        finishedAt = at;
        return true;
    }

    synchronized boolean fail(FailureReason reason, Instant at) {
        if (!state.isActive()) {
            return false;
        }
        state = SessionState.FAILED;
        failureReason = reason;
        finishedAt = at;
        return true;
    }

    public synchronized SessionView view() {
        return new SessionView(id, url, state, failureReason, matchId, createdAt, lastActivityAt, finishedAt);
    }

    @Override
    public String toString() {
        return "AnalysisSession[" + id + ", " + getState() + ", " + url + "]";
    }
}
