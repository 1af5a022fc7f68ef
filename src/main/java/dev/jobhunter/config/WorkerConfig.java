package dev.jobhunter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for spawning analysis worker processes.
 * Loaded from application.yml under 'hunter.worker' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "hunter.worker")
public class WorkerConfig {

    /**
     * Explicit worker command line. Empty means relaunch this application with --analysis-worker.
     */
    private List<String> command = new ArrayList<>();

    /**
     * Extra JVM options for the relaunched worker (ignored when command is set).
     */
    private List<String> javaOptions = new ArrayList<>();

    private Duration gracePeriod = Duration.ofSeconds(5);
}
