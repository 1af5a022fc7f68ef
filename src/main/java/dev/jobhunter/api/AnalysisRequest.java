package dev.jobhunter.api;

/**
 * Body of {@code POST /api/analyses}.
 */
public record AnalysisRequest(String url) {
}
