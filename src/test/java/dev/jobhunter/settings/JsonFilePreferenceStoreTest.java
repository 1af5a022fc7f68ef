package dev.jobhunter.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobhunter.config.StorageConfig;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFilePreferenceStoreTest {

    @TempDir
    Path dataDir;

    private JsonFilePreferenceStore store;

    @BeforeEach
    void setUp() {
        StorageConfig config = new StorageConfig();
        config.setDataDir(dataDir.toString());
        store = new JsonFilePreferenceStore(new ObjectMapper(), config);
    }

    @Test
    void shouldReturnDefaultsWhenFileIsMissing() {
        assertThat(store.load()).isEqualTo(Preferences.defaults());
    }

    @Test
    void shouldPersistUnderSettingsKey() throws IOException {
        Preferences preferences = new Preferences(List.of("Data Engineer"), List.of("Berlin"), List.of("Spark"),
                false, 70_000L, 90_000L, List.of("Initech"));

        store.save(preferences);

        assertThat(store.load()).isEqualTo(preferences);
        String json = Files.readString(dataDir.resolve("job_settings.json"));
        assertThat(json).contains("\"settings\"").contains("Data Engineer");
        assertThat(dataDir.resolve("job_settings.json.tmp")).doesNotExist();
    }

    @Test
    void shouldIgnoreUnknownFields() throws IOException {
        Files.writeString(dataDir.resolve("job_settings.json"),
                "{\"version\": 2, \"settings\": {\"keywords\": [\"Go\"], \"remoteOnly\": true, \"theme\": \"dark\"}}");

        Preferences loaded = store.load();

        assertThat(loaded.keywords()).containsExactly("Go");
        assertThat(loaded.remoteOnly()).isTrue();
        assertThat(loaded.preferredTitles()).isEmpty();
    }

    @Test
    void shouldReportUnreadableFileAsStoreUnavailable() throws IOException {
        Files.writeString(dataDir.resolve("job_settings.json"), "{ not json");

        assertThatThrownBy(() -> store.load())
                .isInstanceOf(AnalysisException.class)
                .extracting(e -> ((AnalysisException) e).getKind())
                .isEqualTo(ErrorKind.STORE_UNAVAILABLE);
    }
}
