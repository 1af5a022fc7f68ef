package dev.jobhunter.supervisor;

import dev.jobhunter.config.FetchConfig;
import dev.jobhunter.config.SessionConfig;
import dev.jobhunter.config.WorkerConfig;
import dev.jobhunter.session.FailureReason;
import dev.jobhunter.worker.WorkerEnvironment;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spawns one worker process per session and owns it until it exits.
 * <p>
 * Every exit path (clean exit, crash, timeout, cancellation, shutdown) releases the
 * process handle and notifies the listener exactly once.
 */
@Slf4j
@Component
public class WorkerSupervisor implements WorkerLauncher {

    /**
     * Added to the page fetch timeout so a slow fetch reaches the worker as FetchFailed
     * before its tool connection read times out.
     */
    static final Duration TOOL_TIMEOUT_MARGIN = Duration.ofSeconds(10);

    private final WorkerCommandFactory commandFactory;
    private final WorkerConfig workerConfig;
    private final SessionConfig sessionConfig;
    private final FetchConfig fetchConfig;

    private final Map<String, ProcessWorkerHandle> liveWorkers = new ConcurrentHashMap<>();
    private final ScheduledExecutorService deadlines;
    private final ExecutorService workerThreads;

    public WorkerSupervisor(WorkerCommandFactory commandFactory, WorkerConfig workerConfig,
            SessionConfig sessionConfig, FetchConfig fetchConfig) {
        this.commandFactory = commandFactory;
        this.workerConfig = workerConfig;
        this.sessionConfig = sessionConfig;
        this.fetchConfig = fetchConfig;
        this.deadlines = Executors.newSingleThreadScheduledExecutor(daemonThreads("worker-deadline"));
        this.workerThreads = Executors.newCachedThreadPool(daemonThreads("worker-io"));
    }

    @Override
    public WorkerHandle launch(WorkerSpec spec, WorkerExitListener listener) {
        List<String> command = commandFactory.command();
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        builder.environment().putAll(new WorkerEnvironment(
                spec.toolHost(), spec.toolPort(), spec.targetUrl(), spec.sessionId(),
                toolTimeout(fetchConfig.getTimeout())).toMap());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new IllegalStateException("Could not start worker for session " + spec.sessionId()
                    + ": " + e.getMessage(), e);
        }

        ProcessWorkerHandle handle = new ProcessWorkerHandle(spec.sessionId(), process, workerConfig.getGracePeriod());
        liveWorkers.put(spec.sessionId(), handle);
        log.info("Spawned worker {} for session {} ({})", process.pid(), spec.sessionId(), spec.targetUrl());

        workerThreads.execute(() -> drainOutput(handle));
        handle.setDeadline(deadlines.schedule(
                () -> workerThreads.execute(() -> {
                    log.warn("Session {} exceeded max duration of {}", spec.sessionId(), sessionConfig.getMaxDuration());
                    handle.terminate(FailureReason.TIMEOUT);
                }),
                sessionConfig.getMaxDuration().toMillis(), TimeUnit.MILLISECONDS));

        process.onExit().whenComplete((exited, error) -> onProcessExit(handle, listener));
        return handle;
    }

    /**
     * Number of workers whose process has not yet been released.
     */
    public int liveWorkerCount() {
        return liveWorkers.size();
    }

    static Duration toolTimeout(Duration fetchTimeout) {
        return fetchTimeout.plus(TOOL_TIMEOUT_MARGIN);
    }

    private void onProcessExit(ProcessWorkerHandle handle, WorkerExitListener listener) {
        liveWorkers.remove(handle.sessionId(), handle);
        handle.release();

        int exitCode = handle.process().exitValue();
        WorkerExit exit = new WorkerExit(handle.sessionId(), exitCode, handle.terminationReason());
        log.info("Worker {} for session {} exited with status {}{}", handle.pid(), handle.sessionId(), exitCode,
                exit.terminationReason() != null ? " (" + exit.terminationReason() + ")" : "");
        try {
            listener.onExit(exit);
        } catch (RuntimeException e) {
            log.error("Worker exit listener failed for session {}: {}", handle.sessionId(), e.getMessage(), e);
        }
    }

    private void drainOutput(ProcessWorkerHandle handle) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(handle.process().getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("[worker {}] {}", handle.sessionId(), line);
            }
        } catch (IOException e) {
            log.debug("Output of worker {} closed: {}", handle.sessionId(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        if (!liveWorkers.isEmpty()) {
            log.info("Stopping {} live worker(s)", liveWorkers.size());
        }
        liveWorkers.values().forEach(handle -> handle.terminate(FailureReason.SHUTDOWN));
        liveWorkers.values().forEach(ProcessWorkerHandle::close);
        deadlines.shutdownNow();
        workerThreads.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
