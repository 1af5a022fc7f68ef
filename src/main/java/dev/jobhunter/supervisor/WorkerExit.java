package dev.jobhunter.supervisor;

import dev.jobhunter.session.FailureReason;

/**
 * Outcome of a worker process.
 *
 * @param terminationReason why the supervisor stopped the worker, or null if it exited on its own
 */
public record WorkerExit(String sessionId, int exitCode, FailureReason terminationReason) {

    public boolean isSuccess() {
        return terminationReason == null && exitCode == 0;
    }
}
