package dev.jobhunter.session;

/**
 * Reason codes carried by a failed session and its "failed" event.
 */
public enum FailureReason {
    /** No tool activity within the idle timeout, or the maximum duration elapsed. */
    TIMEOUT,
    /** Cancelled on request. */
    CANCELLED,
    /** Worker exited with a non-zero status on its own. */
    CRASHED,
    /** Saving the match failed in the store. */
    PERSIST_FAILED,
    /** The worker process could not be started. */
    SPAWN_FAILED,
    /** The application shut down while the worker was running. */
    SHUTDOWN
}
