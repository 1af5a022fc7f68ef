package dev.jobhunter.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRequestDecoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ToolRequestDecoder decoder = new ToolRequestDecoder(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    @DisplayName("Should decode save_job_match with snake_case and the analysis_id alias")
    void shouldDecodeSaveJobMatch() throws Exception {
        ToolRequest request = decoder.decode("save_job_match", json("""
                {"analysis_id": "s1", "url": "https://example.com/jobs/42", "match_score": 72.5,
                 "summary": "ok", "raw_excerpt": "We are hiring", "extra": true}
                """));

        assertThat(request).isInstanceOf(ToolRequest.SaveJobMatch.class);
        ToolRequest.SaveJobMatch save = (ToolRequest.SaveJobMatch) request;
        assertThat(save.match().getSessionId()).isEqualTo("s1");
        assertThat(save.match().getMatchScore()).isEqualTo(72.5);
        assertThat(save.match().getRawExcerpt()).isEqualTo("We are hiring");
    }

    @Test
    @DisplayName("Should default list_job_matches limit to 50")
    void shouldDefaultListLimit() throws Exception {
        assertThat(decoder.decode("list_job_matches", null))
                .isEqualTo(new ToolRequest.ListJobMatches(50));
        assertThat(decoder.decode("list_job_matches", json("{\"limit\": 5}")))
                .isEqualTo(new ToolRequest.ListJobMatches(5));
    }

    @Test
    @DisplayName("Should decode fetch_content with an optional maxLength")
    void shouldDecodeFetchContent() throws Exception {
        assertThat(decoder.decode("fetch_content", json("{\"url\": \"https://example.com\"}")))
                .isEqualTo(new ToolRequest.FetchContent("https://example.com", null));
        assertThat(decoder.decode("fetch_content", json("{\"url\": \"https://example.com\", \"maxLength\": 100}")))
                .isEqualTo(new ToolRequest.FetchContent("https://example.com", 100));
    }

    @Test
    @DisplayName("Should reject unknown tools and schema mismatches as ValidationFailed")
    void shouldRejectBadRequests() throws Exception {
        assertValidationFailure("drop_tables", json("{}"));
        assertValidationFailure("fetch_content", json("{}"));
        assertValidationFailure("fetch_content", json("{\"url\": \"https://example.com\", \"maxLength\": \"big\"}"));
        assertValidationFailure("set_settings", json("{\"settings\": []}"));
        assertValidationFailure("save_job_match", json("{\"url\": \"https://example.com\", \"match_score\": \"high\"}"));
        assertValidationFailure("reload_page", json("[1, 2]"));
    }

    @Test
    @DisplayName("Should decode set_settings into preferences")
    void shouldDecodeSettings() throws Exception {
        ToolRequest request = decoder.decode("set_settings", json("""
                {"settings": {"keywords": ["Java"], "remoteOnly": true, "salaryMin": 1000}}
                """));

        ToolRequest.SetSettings settings = (ToolRequest.SetSettings) request;
        assertThat(settings.settings().keywords()).containsExactly("Java");
        assertThat(settings.settings().remoteOnly()).isTrue();
        assertThat(settings.settings().salaryMin()).isEqualTo(1000L);
    }

    private void assertValidationFailure(String tool, JsonNode arguments) {
        assertThatThrownBy(() -> decoder.decode(tool, arguments))
                .isInstanceOf(AnalysisException.class)
                .extracting(e -> ((AnalysisException) e).getKind())
                .isEqualTo(ErrorKind.VALIDATION_FAILED);
    }
}
