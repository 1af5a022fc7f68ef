package dev.jobhunter.api;

import dev.jobhunter.event.AnalysisEvent;
import dev.jobhunter.event.SessionEventChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Live feed of session events for front ends. Events published before a client connects are not replayed.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EventStreamController {

    private final SessionEventChannel channel;

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<AnalysisEvent>> stream() {
        return channel.events()
                .onBackpressureDrop()
                .map(event -> ServerSentEvent.<AnalysisEvent>builder(event)
                        .event(event.type().eventName())
                        .build());
    }
}
