package dev.jobhunter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for analysis session limits.
 * Loaded from application.yml under 'hunter.session' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "hunter.session")
public class SessionConfig {

    /**
     * Maximum time without tool activity before the session fails with Timeout.
     */
    private Duration idleTimeout = Duration.ofSeconds(30);

    /**
     * Hard cap on the lifetime of a worker process.
     */
    private Duration maxDuration = Duration.ofMinutes(2);

    private Duration watchdogInterval = Duration.ofSeconds(1);
}
