package dev.jobhunter.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobhunter.config.ToolServerConfig;
import dev.jobhunter.metrics.AnalysisMetrics;
import dev.jobhunter.session.AnalysisOrchestrator;
import io.netty.handler.codec.LineBasedFrameDecoder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.tcp.TcpServer;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Loopback TCP server speaking the newline-delimited JSON tool protocol.
 * <p>
 * Requests on one connection are answered strictly in arrival order; connections
 * are served independently of each other.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolServer {

    private static final String DEFAULT_VERSION = "1.0.0";

    private final ToolServerConfig config;
    private final ToolServerEndpoint endpoint;
    private final ObjectMapper objectMapper;
    private final ToolRequestDecoder decoder;
    private final ToolRouter router;
    private final AnalysisOrchestrator orchestrator;
    private final AnalysisMetrics metrics;

    private DisposableServer server;

    @PostConstruct
    public void start() {
        server = TcpServer.create()
                .host(config.getHost())
                .port(config.getPort())
                .doOnConnection(connection -> connection.addHandlerLast(
                        new LineBasedFrameDecoder(config.getMaxLineLength())))
                .handle((inbound, outbound) -> {
                    ToolConnection connection = newConnection();
                    Flux<String> responses = inbound.receive()
                            .asString(StandardCharsets.UTF_8)
                            .filter(line -> !line.isBlank())
                            .concatMap(connection::handle)
                            .map(response -> response + "\n")
                            .doOnError(e -> log.warn("Tool connection failed: {}", e.getMessage()))
                            .onErrorResume(e -> Mono.empty());
                    return outbound.sendString(responses, StandardCharsets.UTF_8)
                            .then()
                            .doFinally(signal -> connection.close());
                })
                .bindNow();

        InetSocketAddress address = (InetSocketAddress) server.address();
        endpoint.bind(address);
        log.info("Tool server listening on {}:{}", address.getHostString(), address.getPort());
    }

    @PreDestroy
    public void stop() {
        endpoint.unbind();
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(5));
            log.info("Tool server stopped");
        }
    }

    private ToolConnection newConnection() {
        String version = ToolServer.class.getPackage().getImplementationVersion();
        return new ToolConnection(objectMapper, decoder, router, orchestrator, metrics,
                version != null ? version : DEFAULT_VERSION);
    }
}
