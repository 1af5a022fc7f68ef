package dev.jobhunter.supervisor;

import dev.jobhunter.session.FailureReason;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link WorkerHandle} over an OS process.
 */
@Slf4j
class ProcessWorkerHandle implements WorkerHandle {

    private final String sessionId;
    private final Process process;
    private final Duration gracePeriod;
    private final AtomicReference<FailureReason> terminationReason = new AtomicReference<>();
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile Future<?> deadline;

    ProcessWorkerHandle(String sessionId, Process process, Duration gracePeriod) {
        this.sessionId = sessionId;
        this.process = process;
        this.gracePeriod = gracePeriod;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    long pid() {
        return process.pid();
    }

    Process process() {
        return process;
    }

    FailureReason terminationReason() {
        return terminationReason.get();
    }

    void setDeadline(Future<?> deadline) {
        this.deadline = deadline;
    }

    @Override
    public void terminate(FailureReason reason) {
        terminationReason.compareAndSet(null, reason);
        if (!process.isAlive()) {
            return;
        }
        log.info("Stopping worker {} for session {} ({})", process.pid(), sessionId, reason);
        process.destroy();
        try {
            if (!process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker {} ignored stop request for {}, killing", process.pid(), gracePeriod);
                process.destroyForcibly();
                process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    /**
     * Kill if alive and release the process resources. Idempotent.
     */
    @Override
    public void close() {
        if (process.isAlive()) {
            terminationReason.compareAndSet(null, FailureReason.SHUTDOWN);
            process.destroyForcibly();
        }
        release();
    }

    void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        Future<?> pending = deadline;
        if (pending != null) {
            pending.cancel(false);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Closing stdin of worker {} failed: {}", process.pid(), e.getMessage());
        }
    }
}
