package dev.jobhunter.util;

import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlUtilsTest {

    @Test
    void shouldTrimValidUrls() {
        assertThat(UrlUtils.requireHttpUrl("  https://example.com/jobs/42 ", "url"))
                .isEqualTo("https://example.com/jobs/42");
        assertThat(UrlUtils.requireHttpUrl("http://jobs.example.org/listing?id=7", "url"))
                .isEqualTo("http://jobs.example.org/listing?id=7");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "example.com/jobs", "ftp://example.com/jobs", "https://", "mailto:hr@example.com"})
    void shouldRejectNonHttpUrls(String candidate) {
        assertThatThrownBy(() -> UrlUtils.requireHttpUrl(candidate, "url"))
                .isInstanceOf(AnalysisException.class)
                .extracting(e -> ((AnalysisException) e).getKind())
                .isEqualTo(ErrorKind.VALIDATION_FAILED);
    }
}
