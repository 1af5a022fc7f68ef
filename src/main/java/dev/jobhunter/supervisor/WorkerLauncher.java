package dev.jobhunter.supervisor;

/**
 * Starts isolated workers for analysis sessions.
 */
public interface WorkerLauncher {

    /**
     * Start a worker for the given session.
     *
     * @param spec     Session id, target URL and tool server address
     * @param listener Notified once when the worker has exited
     * @return The handle owning the worker
     * @throws IllegalStateException if the worker could not be started
     */
    WorkerHandle launch(WorkerSpec spec, WorkerExitListener listener);
}
