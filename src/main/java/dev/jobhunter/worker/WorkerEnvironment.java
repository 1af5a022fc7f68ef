package dev.jobhunter.worker;

import java.time.Duration;
import java.util.Map;

/**
 * Environment variables handed from the supervisor to a worker process.
 *
 * @param toolTimeout read timeout of the worker's tool connection
 */
public record WorkerEnvironment(String toolHost, int toolPort, String targetUrl, String sessionId,
        Duration toolTimeout) {

    public static final String TOOL_HOST = "JOB_HUNTER_TOOL_HOST";
    public static final String TOOL_PORT = "JOB_HUNTER_TOOL_PORT";
    public static final String TARGET_URL = "JOB_HUNTER_TARGET_URL";
    public static final String SESSION_ID = "JOB_HUNTER_SESSION_ID";
    public static final String TOOL_TIMEOUT_MS = "JOB_HUNTER_TOOL_TIMEOUT_MS";

    private static final String DEFAULT_HOST = "127.0.0.1";

    public WorkerEnvironment(String toolHost, int toolPort, String targetUrl, String sessionId) {
        this(toolHost, toolPort, targetUrl, sessionId, ToolClient.DEFAULT_TIMEOUT);
    }

    /**
     * Read the worker settings from an environment map.
     *
     * @throws IllegalArgumentException when the port, URL or session id is missing or malformed,
     *                                  or the timeout is not a positive number of milliseconds
     */
    public static WorkerEnvironment fromMap(Map<String, String> env) {
        String host = env.get(TOOL_HOST);
        return new WorkerEnvironment(
                host == null || host.isBlank() ? DEFAULT_HOST : host,
                parseInt(require(env, TOOL_PORT), TOOL_PORT),
                require(env, TARGET_URL),
                require(env, SESSION_ID),
                parseTimeout(env.get(TOOL_TIMEOUT_MS)));
    }

    public Map<String, String> toMap() {
        return Map.of(
                TOOL_HOST, toolHost,
                TOOL_PORT, String.valueOf(toolPort),
                TARGET_URL, targetUrl,
                SESSION_ID, sessionId,
                TOOL_TIMEOUT_MS, String.valueOf(toolTimeout.toMillis()));
    }

    private static Duration parseTimeout(String value) {
        if (value == null || value.isBlank()) {
            return ToolClient.DEFAULT_TIMEOUT;
        }
        int millis = parseInt(value, TOOL_TIMEOUT_MS);
        if (millis <= 0) {
            throw new IllegalArgumentException("invalid " + TOOL_TIMEOUT_MS + ": " + value);
        }
        return Duration.ofMillis(millis);
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + key + ": " + value, e);
        }
    }

    private static String require(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + key);
        }
        return value;
    }
}
