package dev.jobhunter.worker;

import dev.jobhunter.config.FetchConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerEnvironmentTest {

    @Test
    void shouldReadEnvironmentAndDefaultHost() {
        WorkerEnvironment environment = WorkerEnvironment.fromMap(Map.of(
                WorkerEnvironment.TOOL_PORT, "4100",
                WorkerEnvironment.TARGET_URL, "https://example.com/jobs/42",
                WorkerEnvironment.SESSION_ID, "s1"));

        assertThat(environment.toolHost()).isEqualTo("127.0.0.1");
        assertThat(environment.toolPort()).isEqualTo(4100);
        assertThat(environment.toolTimeout()).isEqualTo(ToolClient.DEFAULT_TIMEOUT);
        assertThat(WorkerEnvironment.fromMap(environment.toMap())).isEqualTo(environment);
    }

    @Test
    void shouldRejectMissingOrInvalidValues() {
        assertThatThrownBy(() -> WorkerEnvironment.fromMap(Map.of(
                WorkerEnvironment.TARGET_URL, "https://example.com", WorkerEnvironment.SESSION_ID, "s1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(WorkerEnvironment.TOOL_PORT);
        assertThatThrownBy(() -> WorkerEnvironment.fromMap(Map.of(
                WorkerEnvironment.TOOL_PORT, "http",
                WorkerEnvironment.TARGET_URL, "https://example.com",
                WorkerEnvironment.SESSION_ID, "s1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReadToolTimeout() {
        WorkerEnvironment environment = WorkerEnvironment.fromMap(Map.of(
                WorkerEnvironment.TOOL_PORT, "4100",
                WorkerEnvironment.TARGET_URL, "https://example.com/jobs/42",
                WorkerEnvironment.SESSION_ID, "s1",
                WorkerEnvironment.TOOL_TIMEOUT_MS, "45000"));

        assertThat(environment.toolTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThatThrownBy(() -> WorkerEnvironment.fromMap(Map.of(
                WorkerEnvironment.TOOL_PORT, "4100",
                WorkerEnvironment.TARGET_URL, "https://example.com/jobs/42",
                WorkerEnvironment.SESSION_ID, "s1",
                WorkerEnvironment.TOOL_TIMEOUT_MS, "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(WorkerEnvironment.TOOL_TIMEOUT_MS);
    }

    @Test
    void shouldDefaultToTimeoutLongerThanFetchTimeout() {
        assertThat(ToolClient.DEFAULT_TIMEOUT).isGreaterThan(new FetchConfig().getTimeout());
    }

    @Test
    void shouldExitWithFailureWhenMisconfigured() {
        assertThat(AnalysisWorker.run(Map.of())).isEqualTo(1);
    }
}
