package dev.jobhunter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Configuration for on-disk state (settings file, match database).
 * Loaded from application.yml under 'hunter.storage' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "hunter.storage")
public class StorageConfig {

    private String dataDir = ".";
    private String settingsFile = "job_settings.json";

    public Path settingsPath() {
        return Path.of(dataDir).resolve(settingsFile);
    }
}
