package dev.jobhunter.service;

import dev.jobhunter.entity.JobMatch;
import dev.jobhunter.model.JobMatchInput;
import dev.jobhunter.supervisor.WorkerLauncher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class MatchStoreIntegrationTest {

    @MockitoBean
    private WorkerLauncher workerLauncher;

    @Autowired
    private MatchStoreService matchStore;

    @BeforeEach
    void setUp() {
        matchStore.clear();
    }

    private JobMatchInput input(String url, double score) {
        return JobMatchInput.builder()
                .url(url)
                .matchScore(score)
                .summary("summary")
                .build();
    }

    @Test
    void shouldListNewestFirstAndRespectLimit() throws InterruptedException {
        matchStore.insert(input("https://example.com/jobs/1", 10));
        Thread.sleep(5);
        matchStore.insert(input("https://example.com/jobs/2", 20));
        Thread.sleep(5);
        matchStore.insert(input("https://example.com/jobs/3", 30));

        List<JobMatch> recent = matchStore.listRecent(2);

        assertThat(recent).extracting(JobMatch::getUrl)
                .containsExactly("https://example.com/jobs/3", "https://example.com/jobs/2");
        assertThat(matchStore.listRecent(50)).hasSize(3);
    }

    @Test
    void shouldKeepEveryConcurrentInsert() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<JobMatch>> inserts = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                String url = "https://example.com/jobs/" + i;
                inserts.add(() -> matchStore.insert(input(url, 50)));
            }
            List<String> ids = new ArrayList<>();
            for (Future<JobMatch> future : executor.invokeAll(inserts)) {
                ids.add(future.get().getId());
            }

            assertThat(ids).doesNotHaveDuplicates();
            assertThat(matchStore.count()).isEqualTo(20);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldClearEverything() {
        matchStore.insert(input("https://example.com/jobs/1", 10));
        matchStore.insert(input("https://example.com/jobs/2", 20));

        assertThat(matchStore.clear()).isEqualTo(2);
        assertThat(matchStore.listRecent(10)).isEmpty();
    }
}
