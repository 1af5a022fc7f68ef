package dev.jobhunter.event;

import dev.jobhunter.session.FailureReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class SessionEventChannelTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private SessionEventChannel channel;

    @BeforeEach
    void setUp() {
        channel = new SessionEventChannel();
    }

    @AfterEach
    void tearDown() {
        channel.close();
    }

    @Test
    void shouldDeliverEventsInPublishOrder() {
        List<AnalysisEvent> received = new CopyOnWriteArrayList<>();
        channel.subscribe(received::add);

        channel.publish(AnalysisEvent.started("s1", "https://example.com/jobs/42", NOW));
        channel.publish(AnalysisEvent.running("s1", NOW));
        channel.publish(AnalysisEvent.completed("s1", "m1", NOW));

        assertThat(received).extracting(AnalysisEvent::type)
                .containsExactly(EventType.STARTED, EventType.RUNNING, EventType.COMPLETED);
    }

    @Test
    void shouldNotReplayEventsToLateSubscribers() {
        channel.publish(AnalysisEvent.started("s1", "https://example.com/jobs/42", NOW));

        StepVerifier.create(channel.events().take(1))
                .then(() -> channel.publish(AnalysisEvent.failed("s1", FailureReason.TIMEOUT, NOW)))
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(EventType.FAILED);
                    assertThat(event.reason()).isEqualTo(FailureReason.TIMEOUT);
                })
                .verifyComplete();
    }

    @Test
    void shouldStopDeliveringAfterDispose() {
        List<AnalysisEvent> received = new CopyOnWriteArrayList<>();
        Disposable subscription = channel.subscribe(received::add);

        channel.publish(AnalysisEvent.reload(NOW));
        subscription.dispose();
        channel.publish(AnalysisEvent.reload(NOW));

        assertThat(received).hasSize(1);
        assertThat(channel.subscriberCount()).isZero();
    }

    @Test
    void shouldIsolateFailingListeners() {
        List<AnalysisEvent> received = new CopyOnWriteArrayList<>();
        channel.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        channel.subscribe(received::add);

        channel.publish(AnalysisEvent.reload(NOW));
        channel.publish(AnalysisEvent.applyQuery("https://example.com/jobs/42", "s1", NOW));

        assertThat(received).hasSize(2);
    }

    @Test
    void shouldCompleteStreamsOnClose() {
        StepVerifier.create(channel.events())
                .then(channel::close)
                .expectComplete()
                .verify(Duration.ofSeconds(2));

        channel.publish(AnalysisEvent.reload(NOW));
        assertThat(channel.isClosed()).isTrue();
    }

    @Test
    void shouldPublishWithoutSubscribers() {
        channel.publish(AnalysisEvent.matchSaved("s1", "m1", NOW));

        assertThat(channel.subscriberCount()).isZero();
    }
}
