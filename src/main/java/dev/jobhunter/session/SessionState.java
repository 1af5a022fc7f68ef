package dev.jobhunter.session;

/**
 * Lifecycle states of an analysis session. "Idle" is the absence of an active session.
 */
public enum SessionState {
    STARTED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == STARTED || this == RUNNING;
    }
}
