package dev.jobhunter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for listing page fetches.
 * Loaded from application.yml under 'hunter.fetch' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "hunter.fetch")
public class FetchConfig {

    private Duration timeout = Duration.ofSeconds(20);
    private String userAgent = "JobHunter/1.0";
    private int defaultMaxLength = 60_000;
    private int textExcerptLength = 2_000;
    private int maxInMemorySize = 10 * 1024 * 1024;
}
