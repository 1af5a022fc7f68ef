package dev.jobhunter.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import dev.jobhunter.metrics.AnalysisMetrics;
import dev.jobhunter.session.AnalysisOrchestrator;
import dev.jobhunter.session.AnalysisSession;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Protocol state of one worker connection: which session it is bound to, and how
 * each request line becomes exactly one response line.
 */
@Slf4j
class ToolConnection {

    static final String PROTOCOL_VERSION = "0.1";
    static final String SERVER_NAME = "job-hunter-tools";

    private final ObjectMapper objectMapper;
    private final ToolRequestDecoder decoder;
    private final ToolRouter router;
    private final AnalysisOrchestrator orchestrator;
    private final AnalysisMetrics metrics;
    private final String serverVersion;

    private volatile String boundSessionId;

    ToolConnection(ObjectMapper objectMapper, ToolRequestDecoder decoder, ToolRouter router,
            AnalysisOrchestrator orchestrator, AnalysisMetrics metrics, String serverVersion) {
        this.objectMapper = objectMapper;
        this.decoder = decoder;
        this.router = router;
        this.orchestrator = orchestrator;
        this.metrics = metrics;
        this.serverVersion = serverVersion;
    }

    /**
     * Handle one request line.
     *
     * @return the serialized response, never an error signal
     */
    Mono<String> handle(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Rejecting malformed request line: {}", e.getOriginalMessage());
            return Mono.just(errorResponse(NullNode.getInstance(),
                    AnalysisException.validation("Malformed JSON request: " + e.getOriginalMessage())));
        }
        if (message == null || !message.isObject()) {
            return Mono.just(errorResponse(NullNode.getInstance(),
                    AnalysisException.validation("Request must be a JSON object")));
        }

        JsonNode id = message.has("id") ? message.get("id") : NullNode.getInstance();
        String method = textOrNull(message.get("method"));
        JsonNode params = message.path("params");

        Mono<Object> result;
        if ("initialize".equals(method)) {
            result = Mono.fromCallable(() -> initialize(params)).subscribeOn(Schedulers.boundedElastic());
        } else if ("list_tools".equals(method)) {
            result = Mono.just(Map.of("tools", ToolName.definitions()));
        } else if ("call_tool".equals(method)) {
            result = callTool(id, params);
        } else {
            result = Mono.error(AnalysisException.validation("Unknown method: " + method));
        }

        return result
                .map(value -> successResponse(id, value))
                .onErrorResume(e -> Mono.just(errorResponse(id, e)));
    }

    /**
     * Release the session binding when the connection goes away.
     */
    void close() {
        String sessionId = boundSessionId;
        if (sessionId != null) {
            orchestrator.detachWorker(sessionId);
            log.debug("Worker connection for session {} closed", sessionId);
        }
    }

    private Object initialize(JsonNode params) {
        String sessionId = textOrNull(params.get("sessionId"));
        if (sessionId == null) {
            throw AnalysisException.validation("initialize: 'sessionId' is required");
        }
        if (boundSessionId != null) {
            throw AnalysisException.validation("Connection is already bound to session " + boundSessionId);
        }
        orchestrator.attachWorker(sessionId);
        boundSessionId = sessionId;
        log.info("Worker initialized for session {}", sessionId);

        Map<String, Object> serverInfo = new LinkedHashMap<>();
        serverInfo.put("name", SERVER_NAME);
        serverInfo.put("version", serverVersion);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.put("serverInfo", serverInfo);
        return result;
    }

    private Mono<Object> callTool(JsonNode id, JsonNode params) {
        String name = textOrNull(params.get("name"));
        ToolName tool = ToolName.fromWireName(name).orElse(null);
        long start = System.nanoTime();

        return Mono.defer(() -> {
                    ToolRequest request = decoder.decode(name, params.get("arguments"));
                    AnalysisSession session = sessionFor(params);
                    return router.route(request, new ToolCallContext(session, id));
                })
                .doOnSuccess(value -> {
                    if (tool != null) {
                        metrics.recordToolCall(tool, Duration.ofNanos(System.nanoTime() - start));
                    }
                })
                .doOnError(e -> {
                    if (tool != null) {
                        metrics.recordToolError(tool, kindOf(e, tool));
                    }
                });
    }

    /**
     * Session of an accepted call. An unbound connection naming a session claims it
     * the same way {@code initialize} does, so a session held by another connection
     * is rejected with SessionBusy.
     */
    private AnalysisSession sessionFor(JsonNode params) {
        if (boundSessionId != null) {
            return orchestrator.recordToolCall(boundSessionId);
        }
        String sessionId = textOrNull(params.get("sessionId"));
        if (sessionId == null) {
            throw AnalysisException.unknownSession(null);
        }
        AnalysisSession session = orchestrator.attachWorker(sessionId);
        boundSessionId = sessionId;
        log.info("Worker connection bound to session {} by call_tool", sessionId);
        return session;
    }

    private String successResponse(JsonNode id, Object result) {
        ObjectNode response = objectMapper.createObjectNode();
        response.set("id", id);
        response.set("result", objectMapper.valueToTree(result));
        return write(id, response);
    }

    private String errorResponse(JsonNode id, Throwable error) {
        ErrorKind kind = kindOf(error, null);
        ObjectNode response = objectMapper.createObjectNode();
        response.set("id", id);
        ObjectNode body = response.putObject("error");
        body.put("kind", kind.code());
        body.put("message", error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        if (!(error instanceof AnalysisException)) {
            log.error("Unclassified tool protocol error: {}", error.getMessage(), error);
        }
        return write(id, response);
    }

    private String write(JsonNode id, ObjectNode response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize response for request {}: {}", id, e.getMessage(), e);
            return "{\"id\":" + id + ",\"error\":{\"kind\":\"" + ErrorKind.VALIDATION_FAILED.code()
                    + "\",\"message\":\"Response could not be serialized\"}}";
        }
    }

    private static ErrorKind kindOf(Throwable error, ToolName tool) {
        if (error instanceof AnalysisException analysisException) {
            return analysisException.getKind();
        }
        return tool != null ? tool.fallbackKind() : ErrorKind.VALIDATION_FAILED;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }
}
