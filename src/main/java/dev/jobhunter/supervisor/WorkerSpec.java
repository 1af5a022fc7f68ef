package dev.jobhunter.supervisor;

/**
 * Everything a worker needs to analyse one URL and reach the tool server.
 */
public record WorkerSpec(String sessionId, String targetUrl, String toolHost, int toolPort) {
}
