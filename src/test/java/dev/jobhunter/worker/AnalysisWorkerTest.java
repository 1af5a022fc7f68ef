package dev.jobhunter.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisWorkerTest {

    private static final String URL = "https://example.com/jobs/42";
    private static final String PAGE_HTML = """
            <html><head><meta name="company" content="Acme"></head>
            <body><h1>Backend Engineer</h1><p>Location: Berlin</p><p>Java, remote friendly</p></body></html>
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<JsonNode> requests = new CopyOnWriteArrayList<>();
    private ServerSocket serverSocket;
    private Thread serverThread;

    @BeforeEach
    void setUp() throws IOException {
        serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
    }

    @AfterEach
    void tearDown() throws Exception {
        serverSocket.close();
        if (serverThread != null) {
            serverThread.join(2000);
        }
    }

    /**
     * Serve one connection, answering each request with the given responder.
     */
    private void serve(Function<JsonNode, ObjectNode> responder) {
        serverThread = new Thread(() -> {
            try (Socket socket = serverSocket.accept()) {
                BufferedReader reader = new BufferedReader(
                        new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
                OutputStream out = socket.getOutputStream();
                String line;
                while ((line = reader.readLine()) != null) {
                    JsonNode request = objectMapper.readTree(line);
                    requests.add(request);
                    ObjectNode response = responder.apply(request);
                    response.set("id", request.get("id"));
                    out.write((objectMapper.writeValueAsString(response) + "\n").getBytes(StandardCharsets.UTF_8));
                    out.flush();
                }
            } catch (IOException e) {
                // server socket closed by tearDown
            }
        });
        serverThread.start();
    }

    private ObjectNode result(Object value) {
        ObjectNode response = objectMapper.createObjectNode();
        response.set("result", objectMapper.valueToTree(value));
        return response;
    }

    private ObjectNode happyPath(JsonNode request) {
        if (!"call_tool".equals(request.path("method").asText())) {
            return result(Map.of("protocolVersion", "0.1"));
        }
        return switch (request.at("/params/name").asText()) {
            case "get_settings" -> result(Map.of("settings", Map.of(
                    "keywords", List.of("Java", "Kotlin"), "remoteOnly", true,
                    "preferredTitles", List.of("Backend"), "locations", List.of("Berlin"))));
            case "fetch_content" -> result(Map.of("status", 200, "url", URL, "title", "Jobs at Acme",
                    "html", PAGE_HTML, "text", "Backend Engineer Location: Berlin Java, remote friendly"));
            case "save_job_match" -> result(Map.of("match", Map.of("id", "m-1")));
            default -> result(Map.of("ok", true));
        };
    }

    private WorkerEnvironment environment() {
        return new WorkerEnvironment("127.0.0.1", serverSocket.getLocalPort(), URL, "session-9");
    }

    @Test
    void shouldRunTheFullToolSequence() {
        serve(this::happyPath);

        int exitCode = new AnalysisWorker(environment(), objectMapper).execute();

        assertThat(exitCode).isZero();
        assertThat(requests).extracting(request -> request.at("/params/name").asText(
                        request.path("method").asText()))
                .containsExactly("initialize", "get_settings", "fetch_content", "save_job_match",
                        "set_query_params", "reload_page");

        JsonNode init = requests.get(0);
        assertThat(init.at("/params/sessionId").asText()).isEqualTo("session-9");
        assertThat(requests.get(2).at("/params/arguments/maxLength").asInt()).isEqualTo(120_000);

        JsonNode save = requests.get(3).at("/params/arguments");
        assertThat(save.get("session_id").asText()).isEqualTo("session-9");
        assertThat(save.get("title").asText()).isEqualTo("Backend Engineer");
        assertThat(save.get("company").asText()).isEqualTo("Acme");
        assertThat(save.get("location").asText()).isEqualTo("Berlin Java, remote friendly");
        // 50% keywords + title 10 + location 6 + remote 8
        assertThat(save.get("match_score").asDouble()).isEqualTo(74.0);
        assertThat(save.get("summary").asText()).startsWith("Matched 74% of keywords. Remote preference: on.");

        JsonNode query = requests.get(4).at("/params/arguments");
        assertThat(query.get("url").asText()).isEqualTo(URL);
        assertThat(query.get("sessionId").asText()).isEqualTo("session-9");
    }

    @Test
    void shouldExitWithFailureOnToolError() {
        serve(request -> {
            if ("fetch_content".equals(request.at("/params/name").asText())) {
                ObjectNode response = objectMapper.createObjectNode();
                ObjectNode error = response.putObject("error");
                error.put("kind", "FetchFailed");
                error.put("message", "HTTP 503");
                return response;
            }
            return happyPath(request);
        });

        int exitCode = new AnalysisWorker(environment(), objectMapper).execute();

        assertThat(exitCode).isEqualTo(1);
        assertThat(requests).extracting(request -> request.at("/params/name").asText())
                .doesNotContain("save_job_match");
    }

    @Test
    void shouldExitWithFailureWhenServerIsUnreachable() throws IOException {
        int port = serverSocket.getLocalPort();
        serverSocket.close();

        int exitCode = new AnalysisWorker(new WorkerEnvironment("127.0.0.1", port, URL, "s"), objectMapper)
                .execute();

        assertThat(exitCode).isEqualTo(1);
    }
}
