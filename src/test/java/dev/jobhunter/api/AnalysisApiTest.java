package dev.jobhunter.api;

import dev.jobhunter.entity.JobMatch;
import dev.jobhunter.error.AnalysisException;
import dev.jobhunter.error.ErrorKind;
import dev.jobhunter.service.MatchStoreService;
import dev.jobhunter.session.AnalysisOrchestrator;
import dev.jobhunter.session.AnalysisSession;
import dev.jobhunter.settings.PreferenceService;
import dev.jobhunter.settings.Preferences;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {AnalysisController.class, MatchController.class, SettingsController.class})
class AnalysisApiTest {

    private static final String URL = "https://example.com/jobs/42";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private WebTestClient client;

    @MockitoBean
    private AnalysisOrchestrator orchestrator;

    @MockitoBean
    private MatchStoreService matchStore;

    @MockitoBean
    private PreferenceService preferenceService;

    @Nested
    @DisplayName("POST /api/analyses")
    class StartAnalysis {

        @Test
        @DisplayName("Should return 201 with the session id and tool port")
        void shouldStart() {
            when(orchestrator.requestAnalysis(URL)).thenReturn(new AnalysisSession("s1", URL, NOW));
            when(orchestrator.toolPort()).thenReturn(41234);

            client.post().uri("/api/analyses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("url", URL))
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.sessionId").isEqualTo("s1")
                    .jsonPath("$.toolPort").isEqualTo(41234);
        }

        @Test
        @DisplayName("Should return 409 while another session is active")
        void shouldRejectWhenBusy() {
            when(orchestrator.requestAnalysis(URL))
                    .thenThrow(new AnalysisException(ErrorKind.SESSION_BUSY, "Session s0 is still in progress"));

            client.post().uri("/api/analyses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("url", URL))
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("SessionBusy");
        }

        @Test
        @DisplayName("Should return 400 for a bad URL")
        void shouldRejectBadUrl() {
            when(orchestrator.requestAnalysis("ftp://example.com"))
                    .thenThrow(AnalysisException.validation("url must be an http(s) URL"));

            client.post().uri("/api/analyses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("url", "ftp://example.com"))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("ValidationFailed");
        }

        @Test
        @DisplayName("Should return 400 without a body")
        void shouldRejectMissingBody() {
            client.post().uri("/api/analyses")
                    .contentType(MediaType.APPLICATION_JSON)
                    .exchange()
                    .expectStatus().isBadRequest();

            verify(orchestrator, never()).requestAnalysis(any());
        }
    }

    @Nested
    @DisplayName("session lookup")
    class Sessions {

        @Test
        @DisplayName("Should return 404 for an unknown session")
        void shouldReturnNotFound() {
            when(orchestrator.getSession("ghost")).thenThrow(AnalysisException.unknownSession("ghost"));

            client.get().uri("/api/analyses/ghost")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("UnknownSession");
        }

        @Test
        @DisplayName("Should list sessions")
        void shouldListSessions() {
            when(orchestrator.listSessions()).thenReturn(List.of(new AnalysisSession("s1", URL, NOW)));

            client.get().uri("/api/analyses")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0].sessionId").isEqualTo("s1")
                    .jsonPath("$[0].state").isEqualTo("STARTED")
                    .jsonPath("$[0].url").isEqualTo(URL);
        }

        @Test
        @DisplayName("Should cancel a session")
        void shouldCancel() {
            when(orchestrator.cancel("s1")).thenReturn(new AnalysisSession("s1", URL, NOW));

            client.delete().uri("/api/analyses/s1")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.sessionId").isEqualTo("s1");

            verify(orchestrator).cancel("s1");
        }
    }

    @Nested
    @DisplayName("matches and settings")
    class MatchesAndSettings {

        @Test
        @DisplayName("Should list matches with the default limit")
        void shouldListMatches() {
            JobMatch match = JobMatch.builder().id("m1").sessionId("s1").url(URL).matchScore(64)
                    .summary("Matched").createdAt(NOW).build();
            when(matchStore.listRecent(MatchStoreService.DEFAULT_LIST_LIMIT)).thenReturn(List.of(match));

            client.get().uri("/api/matches")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0].id").isEqualTo("m1")
                    .jsonPath("$[0].match_score").isEqualTo(64.0);
        }

        @Test
        @DisplayName("Should reject an out-of-range limit")
        void shouldRejectBadLimit() {
            when(matchStore.listRecent(0)).thenThrow(AnalysisException.validation("limit must be a positive integer, got 0"));

            client.get().uri("/api/matches?limit=0")
                    .exchange()
                    .expectStatus().isBadRequest();
        }

        @Test
        @DisplayName("Should report how many matches were cleared")
        void shouldClearMatches() {
            when(matchStore.clear()).thenReturn(4);

            client.delete().uri("/api/matches")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.removed").isEqualTo(4);
        }

        @Test
        @DisplayName("Should map an unreadable settings store to 503")
        void shouldReportStoreUnavailable() {
            when(preferenceService.current())
                    .thenThrow(new AnalysisException(ErrorKind.STORE_UNAVAILABLE, "settings file unreadable"));

            client.get().uri("/api/settings")
                    .exchange()
                    .expectStatus().isEqualTo(503)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("StoreUnavailable");
        }

        @Test
        @DisplayName("Should return the normalized settings after an update")
        void shouldUpdateSettings() {
            when(preferenceService.update(any())).thenReturn(Preferences.defaults());

            client.put().uri("/api/settings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("keywords", List.of(" Java ")))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.keywords").isArray();
        }
    }
}
