package dev.jobhunter.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Blocking client for the tool protocol: one request line out, one response line back.
 */
public class ToolClient implements Closeable {

    /**
     * Read timeout when the supervisor passes none. Longer than the default page fetch timeout.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Socket socket;
    private final BufferedReader reader;
    private final BufferedWriter writer;
    private final ObjectMapper objectMapper;
    private long nextId = 1;

    private ToolClient(Socket socket, ObjectMapper objectMapper) throws IOException {
        this.socket = socket;
        this.objectMapper = objectMapper;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    public static ToolClient connect(String host, int port, Duration timeout, ObjectMapper objectMapper)
            throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            socket.setSoTimeout((int) timeout.toMillis());
            return new ToolClient(socket, objectMapper);
        } catch (IOException e) {
            socket.close();
            throw new IOException("connect to tool server " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }

    /**
     * Send a request and wait for its response.
     *
     * @return the {@code result} member of the response
     * @throws ToolCallException when the server answers with an error
     * @throws IOException       on transport failure, timeout or an unreadable response
     */
    public synchronized JsonNode send(String method, Object params) throws IOException {
        String id = String.valueOf(nextId++);
        ObjectNode request = objectMapper.createObjectNode();
        request.put("id", id);
        request.put("method", method);
        request.set("params", objectMapper.valueToTree(params));

        writer.write(objectMapper.writeValueAsString(request));
        writer.write('\n');
        writer.flush();

        String line = reader.readLine();
        if (line == null) {
            throw new IOException("tool server closed the connection during " + method);
        }
        JsonNode response = objectMapper.readTree(line);
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new ToolCallException(error.path("kind").asText("Unknown"),
                    error.path("message").asText("unknown tool error"));
        }
        return response.path("result");
    }

    public JsonNode initialize(String sessionId) throws IOException {
        return send("initialize", Map.of("sessionId", sessionId));
    }

    public JsonNode callTool(String name, Map<String, ?> arguments) throws IOException {
        return send("call_tool", Map.of("name", name, "arguments", arguments));
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    /**
     * An error response from the tool server.
     */
    public static class ToolCallException extends IOException {

        private final String kind;

        public ToolCallException(String kind, String message) {
            super(kind + ": " + message);
            this.kind = kind;
        }

        public String getKind() {
            return kind;
        }
    }
}
