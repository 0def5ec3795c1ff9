package com.ward.core.service.api.controller;

import com.ward.core.service.config.WardConfig;
import com.ward.core.service.stream.SessionUpdate;
import com.ward.core.service.stream.SessionUpdatePublisher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Server-sent event stream of session updates.
 */
@Slf4j
@RestController
@Tag(name = "Session Stream", description = "Live session updates over server-sent events")
@RequiredArgsConstructor
public class SessionStreamController {

    static final String EVENT_NAME = "sessions-update";

    private final SessionUpdatePublisher publisher;
    private final WardConfig wardConfig;

    @GetMapping(path = "/sessions/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream session updates",
               description = "Emits a '" + EVENT_NAME + "' event with all sessions and their issues after each burst of ingestion")
    public SseEmitter stream() {
        SseEmitter emitter = new SseEmitter(wardConfig.getStream().getSubscriberTimeoutMs());

        SessionUpdatePublisher.Subscription subscription = publisher.subscribe(update -> send(emitter, update));
        emitter.onCompletion(subscription::cancel);
        emitter.onTimeout(() -> {
            subscription.cancel();
            emitter.complete();
        });
        emitter.onError(error -> subscription.cancel());

        log.debug("Stream subscriber connected, total: {}", publisher.getSubscriberCount());
        // Send the current state right away instead of waiting for the next write
        publisher.requestPublish();
        return emitter;
    }

    private void send(SseEmitter emitter, SessionUpdate update) {
        try {
            emitter.send(SseEmitter.event()
                    .name(EVENT_NAME)
                    .id(String.valueOf(update.sequence()))
                    .data(update, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            // The publisher drops this subscriber when delivery throws
            throw new UncheckedIOException("Stream subscriber disconnected", e);
        }
    }
}
