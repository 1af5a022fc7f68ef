package dev.jobhunter.supervisor;

@FunctionalInterface
public interface WorkerExitListener {

    /**
     * Called exactly once per launched worker, after its process handle is released.
     */
    void onExit(WorkerExit exit);
}
