package dev.jobhunter.supervisor;

import dev.jobhunter.session.FailureReason;

/**
 * Owned handle to a running worker. Closing it kills the worker if still alive.
 */
public interface WorkerHandle extends AutoCloseable {

    String sessionId();

    boolean isAlive();

    /**
     * Ask the worker to stop, wait the grace period, then kill it if it is still alive.
     * The first reason given wins and is reported in the {@link WorkerExit}.
     */
    void terminate(FailureReason reason);

    @Override
    void close();
}
