package dev.jobhunter.metrics;

import dev.jobhunter.error.ErrorKind;
import dev.jobhunter.session.FailureReason;
import dev.jobhunter.tool.ToolName;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for analysis sessions and tool calls.
 */
@Component
public class AnalysisMetrics {

    private static final String TAG_TOOL = "tool";
    private static final String TAG_KIND = "kind";
    private static final String TAG_REASON = "reason";

    private final MeterRegistry registry;

    // Counters
    private final Counter sessionsStartedCounter;
    private final Counter sessionsCompletedCounter;
    private final Counter matchesSavedCounter;

    // Timers
    private final Timer sessionDurationTimer;
    private final ConcurrentHashMap<ToolName, Timer> toolTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger activeSessions = new AtomicInteger(0);

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.sessionsStartedCounter = Counter.builder("job_hunter_sessions_started_total")
                .description("Total analysis sessions started")
                .register(registry);

        this.sessionsCompletedCounter = Counter.builder("job_hunter_sessions_completed_total")
                .description("Total analysis sessions completed successfully")
                .register(registry);

        this.matchesSavedCounter = Counter.builder("job_hunter_matches_saved_total")
                .description("Total job matches persisted")
                .register(registry);

        this.sessionDurationTimer = Timer.builder("job_hunter_session_duration")
                .description("Time from session start to its terminal state")
                .register(registry);

        Gauge.builder("job_hunter_active_sessions", activeSessions, AtomicInteger::get)
                .description("Sessions currently started or running")
                .register(registry);
    }

    public void recordSessionStarted() {
        sessionsStartedCounter.increment();
        activeSessions.incrementAndGet();
    }

    public void recordSessionCompleted(Duration duration) {
        sessionsCompletedCounter.increment();
        sessionFinished(duration);
    }

    public void recordSessionFailed(FailureReason reason, Duration duration) {
        Counter.builder("job_hunter_sessions_failed_total")
                .description("Total analysis sessions that failed, by reason")
                .tag(TAG_REASON, reason.name())
                .register(registry)
                .increment();
        sessionFinished(duration);
    }

    public void recordMatchSaved() {
        matchesSavedCounter.increment();
    }

    /**
     * Record a tool call that returned a result.
     */
    public void recordToolCall(ToolName tool, Duration latency) {
        Counter.builder("job_hunter_tool_calls_total")
                .tag(TAG_TOOL, tool.wireName())
                .register(registry)
                .increment();
        getToolTimer(tool).record(latency);
    }

    /**
     * Record a tool call that failed with a classified error.
     */
    public void recordToolError(ToolName tool, ErrorKind kind) {
        Counter.builder("job_hunter_tool_errors_total")
                .tag(TAG_TOOL, tool.wireName())
                .tag(TAG_KIND, kind.code())
                .register(registry)
                .increment();
    }

    public int getActiveSessions() {
        return activeSessions.get();
    }

    private Timer getToolTimer(ToolName tool) {
        return toolTimers.computeIfAbsent(tool, name ->
                Timer.builder("job_hunter_tool_call_duration")
                        .description("Time to serve a tool call")
                        .tag(TAG_TOOL, name.wireName())
                        .register(registry));
    }

    private void sessionFinished(Duration duration) {
        activeSessions.updateAndGet(current -> Math.max(0, current - 1));
        sessionDurationTimer.record(duration);
    }
}
