package dev.jobhunter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the worker-facing tool server.
 * Loaded from application.yml under 'hunter.tool-server' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "hunter.tool-server")
public class ToolServerConfig {

    private String host = "127.0.0.1";
    private int port = 0;
    private int maxLineLength = 1024 * 1024;
}
