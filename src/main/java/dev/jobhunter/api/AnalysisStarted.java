package dev.jobhunter.api;

/**
 * Response of {@code POST /api/analyses}: the new session and the tool server port its worker talks to.
 */
public record AnalysisStarted(String sessionId, int toolPort) {
}
