package dev.jobhunter.event;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Best-effort fan-out of lifecycle and control events to observers.
 * <p>
 * Events are not replayed: an observer only sees events published after it subscribed.
 * A subscriber that cannot keep up loses events rather than slowing publishers down.
 */
@Slf4j
@Component
public class SessionEventChannel {

    private final Sinks.Many<AnalysisEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Set<Disposable> subscriptions = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    /**
     * Publish an event to every current subscriber. A no-op once the channel is closed.
     */
    public synchronized void publish(AnalysisEvent event) {
        if (closed) {
            log.debug("Channel closed, dropping {} event", event.type().eventName());
            return;
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Event {} for session {} not delivered: {}", event.type().eventName(), event.sessionId(), result);
        } else {
            log.debug("Published {} event for session {}", event.type().eventName(), event.sessionId());
        }
    }

    /**
     * Stream of events published from now on. Completes when the channel closes.
     */
    public Flux<AnalysisEvent> events() {
        return sink.asFlux();
    }

    /**
     * Register a listener. Dispose the returned handle to unregister.
     */
    public Disposable subscribe(Consumer<AnalysisEvent> listener) {
        subscriptions.removeIf(Disposable::isDisposed);
        Disposable subscription = sink.asFlux()
                .subscribe(event -> {
                    try {
                        listener.accept(event);
                    } catch (RuntimeException e) {
                        log.warn("Event listener failed on {}: {}", event.type().eventName(), e.getMessage(), e);
                    }
                });
        if (!subscription.isDisposed()) {
            subscriptions.add(subscription);
        }
        return subscription;
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Complete the stream and release every subscription.
     */
    @PreDestroy
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        sink.tryEmitComplete();
        subscriptions.forEach(Disposable::dispose);
        subscriptions.clear();
        log.info("Event channel closed");
    }
}
