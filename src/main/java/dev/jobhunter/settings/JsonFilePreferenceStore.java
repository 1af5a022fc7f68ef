package dev.jobhunter.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobhunter.config.StorageConfig;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Preference source backed by a JSON file in the data directory.
 * The file holds a single object with a "settings" entry.
 */
@Slf4j
@Component
public class JsonFilePreferenceStore implements PreferenceSource {

    static final String SETTINGS_KEY = "settings";

    private final ObjectMapper objectMapper;
    private final Path file;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public JsonFilePreferenceStore(ObjectMapper objectMapper, StorageConfig storageConfig) {
        this.objectMapper = objectMapper;
        this.file = storageConfig.settingsPath();
    }

    @Override
    public Preferences load() {
        lock.readLock().lock();
        try {
            if (!Files.exists(file)) {
                log.debug("{} not found. Using default preferences.", file);
                return Preferences.defaults();
            }
            SettingsDocument document = objectMapper.readValue(file.toFile(), SettingsDocument.class);
            return document.settings() != null ? document.settings() : Preferences.defaults();
        } catch (IOException e) {
            log.error("Failed to read settings from {}: {}", file, e.getMessage());
            throw new AnalysisException(ErrorKind.STORE_UNAVAILABLE, "Settings store unreadable: " + e.getMessage(), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Preferences save(Preferences preferences) {
        lock.writeLock().lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(tmp.toFile(), Map.of(SETTINGS_KEY, preferences));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Saved preferences to {}", file);
            return preferences;
        } catch (IOException e) {
            log.error("Failed to write settings to {}: {}", file, e.getMessage());
            throw new AnalysisException(ErrorKind.STORE_UNAVAILABLE, "Settings store unwritable: " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsDocument(Preferences settings) {
    }
}
