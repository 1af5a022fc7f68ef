package dev.jobhunter.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobhunter.settings.Preferences;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point of the worker process: analyses one listing through the tool server
 * and exits.
 * <p>
 * Steps: initialize, get_settings, fetch_content, extract and score, save_job_match,
 * set_query_params, reload_page. Exit status 0 on success, 1 on any failure.
 */
@Slf4j
public class AnalysisWorker {

    static final int FETCH_MAX_LENGTH = 120_000;

    private static final String SEPARATOR = "========================================";

    private final WorkerEnvironment environment;
    private final ObjectMapper objectMapper;
    private final ListingExtractor extractor = new ListingExtractor();
    private final ListingScorer scorer = new ListingScorer();

    public AnalysisWorker(WorkerEnvironment environment, ObjectMapper objectMapper) {
        this.environment = environment;
        this.objectMapper = objectMapper;
    }

    /**
     * Run a worker configured from environment variables.
     *
     * @return process exit status
     */
    public static int run(Map<String, String> env) {
        WorkerEnvironment environment;
        try {
            environment = WorkerEnvironment.fromMap(env);
        } catch (IllegalArgumentException e) {
            log.error("Analysis worker misconfigured: {}", e.getMessage());
            return 1;
        }
        return new AnalysisWorker(environment, new ObjectMapper()).execute();
    }

    public int execute() {
        log.info(SEPARATOR);
        log.info("Analysis worker starting for session {}", environment.sessionId());
        log.info("Target: {}", environment.targetUrl());
        log.info(SEPARATOR);

        try (ToolClient client = ToolClient.connect(environment.toolHost(), environment.toolPort(),
                environment.toolTimeout(), objectMapper)) {
            String matchId = analyse(client);

            log.info(SEPARATOR);
            log.info("Analysis completed successfully");
            log.info("Match saved: {}", matchId);
            log.info(SEPARATOR);
            return 0;
        } catch (IOException | RuntimeException e) {
            log.error("Analysis of {} failed: {}", environment.targetUrl(), e.getMessage(), e);
            return 1;
        }
    }

    /**
     * @return id of the saved match
     */
    String analyse(ToolClient client) throws IOException {
        String url = environment.targetUrl();
        String sessionId = environment.sessionId();

        client.initialize(sessionId);
        Preferences preferences = readPreferences(client.callTool("get_settings", Map.of()));

        JsonNode page = client.callTool("fetch_content", Map.of("url", url, "maxLength", FETCH_MAX_LENGTH));
        log.info("Fetched {} (status {})", url, page.path("status").asInt());

        ExtractedListing listing = extractor.extract(
                page.path("html").asText(""),
                page.path("text").asText(""),
                page.path("title").asText(""));
        ListingScorer.ScoringResult scoring = scorer.score(listing, preferences);
        log.info("Scored '{}' at {} {}", listing.title(), scoring.score(), scoring.breakdown());

        Map<String, Object> match = new LinkedHashMap<>();
        match.put("session_id", sessionId);
        match.put("url", url);
        match.put("title", listing.title());
        match.put("company", listing.company());
        match.put("location", listing.location());
        match.put("match_score", scoring.score());
        match.put("summary", scoring.summary());
        match.put("raw_excerpt", listing.rawExcerpt());
        JsonNode saved = client.callTool("save_job_match", match);

        client.callTool("set_query_params", Map.of("url", url, "sessionId", sessionId));
        client.callTool("reload_page", Map.of());
        return saved.path("match").path("id").asText(null);
    }

    private Preferences readPreferences(JsonNode result) {
        JsonNode settings = result.get("settings");
        if (settings == null || settings.isNull()) {
            return Preferences.defaults();
        }
        try {
            return objectMapper.treeToValue(settings, Preferences.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable settings, using defaults: {}", e.getOriginalMessage());
            return Preferences.defaults();
        }
    }
}
