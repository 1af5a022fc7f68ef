package dev.jobhunter.session;

import dev.jobhunter.config.SessionConfig;
import dev.jobhunter.entity.JobMatch;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import dev.jobhunter.event.AnalysisEvent;
import dev.jobhunter.event.SessionEventChannel;
import dev.jobhunter.metrics.AnalysisMetrics;
import dev.jobhunter.supervisor.WorkerExit;
import dev.jobhunter.supervisor.WorkerHandle;
import dev.jobhunter.supervisor.WorkerLauncher;
import dev.jobhunter.supervisor.WorkerSpec;
import dev.jobhunter.tool.ToolServerEndpoint;
import dev.jobhunter.util.UrlUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the lifecycle of analysis sessions.
 * <p>
 * At most one session is active at a time; a request made while one is STARTED or
 * RUNNING is rejected with {@link ErrorKind#SESSION_BUSY}. Terminal transitions
 * happen once, whichever of worker exit, idle watchdog, cancellation or persistence
 * failure gets there first.
 */
@Slf4j
@Service
public class AnalysisOrchestrator {

    private final WorkerLauncher launcher;
    private final ToolServerEndpoint endpoint;
    private final SessionEventChannel events;
    private final AnalysisMetrics metrics;
    private final SessionConfig sessionConfig;
    private final Clock clock;

    private final Map<String, AnalysisSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, WorkerHandle> workers = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();
    private final ExecutorService reaper = Executors.newCachedThreadPool(daemonThreads("session-reaper"));
    private ScheduledExecutorService watchdog;

    // guarded by admissionLock
    private AnalysisSession activeSession;

    public AnalysisOrchestrator(WorkerLauncher launcher, ToolServerEndpoint endpoint, SessionEventChannel events,
            AnalysisMetrics metrics, SessionConfig sessionConfig, Clock clock) {
        this.launcher = launcher;
        this.endpoint = endpoint;
        this.events = events;
        this.metrics = metrics;
        this.sessionConfig = sessionConfig;
        this.clock = clock;
    }

    @PostConstruct
    public void startWatchdog() {
        long interval = sessionConfig.getWatchdogInterval().toMillis();
        watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreads("session-watchdog"));
        watchdog.scheduleWithFixedDelay(() -> {
            try {
                checkIdleSessions();
            } catch (RuntimeException e) {
                log.error("Idle session check failed: {}", e.getMessage(), e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Session watchdog started (idle timeout {}, max duration {})",
                sessionConfig.getIdleTimeout(), sessionConfig.getMaxDuration());
    }

    /**
     * Start analysing a job listing.
     * The {@code started} event is published before this method returns.
     *
     * @throws AnalysisException ValidationFailed for a bad URL, SessionBusy while another session is active
     */
    public AnalysisSession requestAnalysis(String url) {
        String targetUrl = UrlUtils.requireHttpUrl(url, "url");

        AnalysisSession session;
        synchronized (admissionLock) {
            if (activeSession != null && activeSession.isActive()) {
                throw new AnalysisException(ErrorKind.SESSION_BUSY,
                        "Session " + activeSession.getId() + " is still in progress");
            }
            Instant now = clock.instant();
            session = new AnalysisSession(UUID.randomUUID().toString(), targetUrl, now);
            sessions.put(session.getId(), session);
            activeSession = session;
            metrics.recordSessionStarted();
            events.publish(AnalysisEvent.started(session.getId(), targetUrl, now));
        }
        log.info("Session {} started for {}", session.getId(), targetUrl);

        try {
            InetSocketAddress toolAddress = endpoint.address();
            if (toolAddress == null) {
                throw new IllegalStateException("Tool server is not listening");
            }
            WorkerHandle handle = launcher.launch(
                    new WorkerSpec(session.getId(), targetUrl, toolAddress.getHostString(), toolAddress.getPort()),
                    this::onWorkerExit);
            workers.put(session.getId(), handle);
            if (!session.isActive()) {
                // finished while the worker was being launched
                workers.remove(session.getId(), handle);
                handle.close();
            }
        } catch (RuntimeException e) {
            log.error("Failed to launch worker for session {}: {}", session.getId(), e.getMessage(), e);
            finish(session, FailureReason.SPAWN_FAILED);
        }
        return session;
    }

    /**
     * Bind a worker connection to its session.
     *
     * @throws AnalysisException UnknownSession if absent or finished, SessionBusy if another connection holds it
     */
    public AnalysisSession attachWorker(String sessionId) {
        AnalysisSession session = requireActive(sessionId);
        if (!session.attachWorker()) {
            if (!session.isActive()) {
                throw AnalysisException.unknownSession(sessionId);
            }
            throw new AnalysisException(ErrorKind.SESSION_BUSY,
                    "Session " + sessionId + " is already bound to a worker connection");
        }
        recordActivity(session);
        log.debug("Worker connection bound to session {}", sessionId);
        return session;
    }

    public void detachWorker(String sessionId) {
        AnalysisSession session = sessions.get(sessionId);
        if (session != null) {
            session.detachWorker();
        }
    }

    /**
     * Accept a tool call for a session and refresh its activity timestamp.
     *
     * @throws AnalysisException UnknownSession if absent or finished
     */
    public AnalysisSession recordToolCall(String sessionId) {
        AnalysisSession session = requireActive(sessionId);
        recordActivity(session);
        return session;
    }

    public void onMatchSaved(AnalysisSession session, JobMatch match) {
        session.linkMatch(match.getId());
        metrics.recordMatchSaved();
        String owner = match.getSessionId() != null ? match.getSessionId() : session.getId();
        events.publish(AnalysisEvent.matchSaved(owner, match.getId(), clock.instant()));
        log.info("Session {} saved match {} (score {})", session.getId(), match.getId(), match.getMatchScore());
    }

    /**
     * A match could not be stored: the session fails and its worker is stopped.
     */
    public void onPersistFailure(AnalysisSession session) {
        finish(session, FailureReason.PERSIST_FAILED);
        terminateAsync(session.getId(), FailureReason.PERSIST_FAILED);
    }

    /**
     * Stop a session's worker and fail the session with CANCELLED.
     * Blocks for up to the worker grace period. Cancelling a finished session is a no-op.
     */
    public AnalysisSession cancel(String sessionId) {
        AnalysisSession session = getSession(sessionId);
        if (!session.isActive()) {
            log.debug("Session {} already finished, nothing to cancel", sessionId);
            return session;
        }
        log.info("Cancelling session {}", sessionId);
        WorkerHandle handle = workers.get(sessionId);
        if (handle != null) {
            handle.terminate(FailureReason.CANCELLED);
        }
        finish(session, FailureReason.CANCELLED);
        return session;
    }

    /**
     * Exit notification from the supervisor. Ignored when the session already finished.
     */
    public void onWorkerExit(WorkerExit exit) {
        workers.remove(exit.sessionId());
        AnalysisSession session = sessions.get(exit.sessionId());
        if (session == null) {
            log.warn("Exit reported for unknown session {}", exit.sessionId());
            return;
        }
        if (exit.terminationReason() != null) {
            finish(session, exit.terminationReason());
        } else if (exit.isSuccess()) {
            finish(session, null);
        } else {
            log.warn("Worker for session {} exited with status {}", exit.sessionId(), exit.exitCode());
            finish(session, FailureReason.CRASHED);
        }
    }

    /**
     * Fail every active session that has seen no tool activity for the idle timeout.
     */
    public void checkIdleSessions() {
        Instant now = clock.instant();
        Duration idleTimeout = sessionConfig.getIdleTimeout();
        for (AnalysisSession session : sessions.values()) {
            if (!session.isActive()) {
                continue;
            }
            Duration idle = Duration.between(session.getLastActivityAt(), now);
            if (idle.compareTo(idleTimeout) >= 0) {
                log.warn("Session {} idle for {}, timing out", session.getId(), idle);
                finish(session, FailureReason.TIMEOUT);
                terminateAsync(session.getId(), FailureReason.TIMEOUT);
            }
        }
    }

    public AnalysisSession getSession(String sessionId) {
        AnalysisSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            throw new AnalysisException(ErrorKind.UNKNOWN_SESSION, "Unknown session: " + sessionId);
        }
        return session;
    }

    /**
     * All sessions of this process, most recent first.
     */
    public List<AnalysisSession> listSessions() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(AnalysisSession::getCreatedAt).reversed())
                .toList();
    }

    public Optional<AnalysisSession> activeSession() {
        synchronized (admissionLock) {
            return Optional.ofNullable(activeSession).filter(AnalysisSession::isActive);
        }
    }

    public int toolPort() {
        return endpoint.port();
    }

    @PreDestroy
    public void shutdown() {
        if (watchdog != null) {
            watchdog.shutdownNow();
        }
        sessions.values().stream()
                .filter(AnalysisSession::isActive)
                .forEach(session -> finish(session, FailureReason.SHUTDOWN));
        workers.values().forEach(WorkerHandle::close);
        workers.clear();
        reaper.shutdownNow();
    }

    private AnalysisSession requireActive(String sessionId) {
        AnalysisSession session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null || !session.isActive()) {
            throw AnalysisException.unknownSession(sessionId);
        }
        return session;
    }

    private void recordActivity(AnalysisSession session) {
        synchronized (session) {
            Instant now = clock.instant();
            if (session.markActivity(now)) {
                log.info("Session {} is running", session.getId());
                events.publish(AnalysisEvent.running(session.getId(), now));
            }
        }
    }

    /**
     * Move a session to its terminal state. A null reason means success.
     */
    private void finish(AnalysisSession session, FailureReason reason) {
        synchronized (session) {
            Instant now = clock.instant();
            boolean transitioned = reason == null ? session.complete(now) : session.fail(reason, now);
            if (!transitioned) {
                log.debug("Session {} already {}, ignoring {}", session.getId(), session.getState(),
                        reason != null ? reason : "completion");
                return;
            }

            Duration duration = Duration.between(session.getCreatedAt(), now);
            if (reason == null) {
                metrics.recordSessionCompleted(duration);
                events.publish(AnalysisEvent.completed(session.getId(), session.getMatchId(), now));
                log.info("Session {} completed in {}ms (match {})", session.getId(), duration.toMillis(),
                        session.getMatchId());
            } else {
                metrics.recordSessionFailed(reason, duration);
                events.publish(AnalysisEvent.failed(session.getId(), reason, now));
                log.warn("Session {} failed: {}", session.getId(), reason);
            }
        }
        // admissionLock is never taken while holding a session lock
        synchronized (admissionLock) {
            if (activeSession == session) {
                activeSession = null;
            }
        }
    }

    private void terminateAsync(String sessionId, FailureReason reason) {
        WorkerHandle handle = workers.get(sessionId);
        if (handle == null) {
            return;
        }
        reaper.execute(() -> handle.terminate(reason));
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
