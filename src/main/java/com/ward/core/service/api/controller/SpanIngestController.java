package com.ward.core.service.api.controller;

import com.ward.core.service.api.dto.ApiResponse;
import com.ward.core.service.api.dto.IngestionResult;
import com.ward.core.service.api.dto.NavigationEventRequest;
import com.ward.core.service.api.dto.SpanIngestRequest;
import com.ward.core.service.config.IngestionConfig;
import com.ward.core.service.config.MetricsConfig;
import com.ward.core.service.config.WardConfig;
import com.ward.core.service.ingest.IngestionException;
import com.ward.core.service.ingest.IngestionQueue;
import com.ward.core.service.ingest.IngestionWorkItem;
import com.ward.core.service.runtime.SessionTracker;
import com.ward.core.span.InvalidSpanException;
import com.ward.core.span.NavigationEvent;
import com.ward.core.span.RawSpan;
import com.ward.core.span.SpanNormalizer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Controller for span and navigation event ingestion.
 *
 * Validates input synchronously and hands it to the ingestion queue; correlation and
 * session rebuilding happen on the ingestion worker.
 */
@Slf4j
@RestController
@RequestMapping("/ingest")
@Tag(name = "Telemetry Ingestion", description = "Endpoints for ingesting spans and navigation events")
@RequiredArgsConstructor
public class SpanIngestController {

    private final IngestionQueue ingestionQueue;
    private final SpanNormalizer spanNormalizer;
    private final IngestionConfig ingestionConfig;
    private final WardConfig wardConfig;
    private final MetricsConfig metricsConfig;
    private final SessionTracker sessionTracker;

    /**
     * Ingests a batch of spans.
     *
     * @param request the span batch
     * @return 202 Accepted with accepted/skipped counts, 429 if the queue is full
     */
    @PostMapping("/spans")
    @Operation(
            summary = "Ingest spans",
            description = "Submits client and server spans. Malformed spans are skipped; the rest are correlated into page sessions."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Spans accepted for processing"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Ingestion queue full"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Ingestion disabled")
    })
    public ResponseEntity<ApiResponse<IngestionResult>> ingestSpans(
            @Valid @RequestBody SpanIngestRequest request) {

        requireEnabled();

        List<RawSpan> spans = new ArrayList<>(request.getSpans().size());
        int skipped = 0;
        for (SpanIngestRequest.SpanDto dto : request.getSpans()) {
            if (dto == null) {
                skipped++;
                log.warn("Skipping null span entry");
                continue;
            }
            try {
                spans.add(spanNormalizer.normalize(dto.toDraft()));
            } catch (InvalidSpanException e) {
                skipped++;
                log.warn("Skipping invalid span {}: {}", e.getSpanId(), e.getMessage());
            } catch (IllegalArgumentException e) {
                skipped++;
                log.warn("Skipping invalid span {}: {}", dto.getId(), e.getMessage());
            }
        }
        if (skipped > 0) {
            metricsConfig.getSkippedItems().increment(skipped);
        }

        if (spans.isEmpty()) {
            log.debug("No valid spans in batch, {} skipped", skipped);
            return ResponseEntity.accepted()
                    .body(ApiResponse.success(IngestionResult.builder().accepted(0).skipped(skipped).build()));
        }

        String batchId = UUID.randomUUID().toString();
        boolean enqueued = ingestionQueue.enqueue(
                new IngestionWorkItem.SpanBatchWorkItem(batchId, spans, sessionTracker.getGeneration()),
                ingestionConfig.getTimeout().getEnqueueMs());

        if (!enqueued) {
            log.warn("Ingestion queue full, rejecting span batch of {} spans", spans.size());
            return queueFullResponse();
        }

        log.debug("Span batch accepted: batchId={}, accepted={}, skipped={}", batchId, spans.size(), skipped);
        return ResponseEntity.accepted()
                .body(ApiResponse.success(IngestionResult.builder()
                        .accepted(spans.size())
                        .skipped(skipped)
                        .batchId(batchId)
                        .build()));
    }

    /**
     * Ingests a navigation event.
     *
     * @param request the navigation event
     * @return 202 Accepted with the session id, 400 if invalid, 429 if the queue is full
     */
    @PostMapping("/navigation")
    @Operation(
            summary = "Ingest navigation event",
            description = "Submits a browser navigation event. It may arrive before, with or after the session's spans."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Event accepted for processing"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid event"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Ingestion queue full"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Ingestion disabled")
    })
    public ResponseEntity<ApiResponse<String>> ingestNavigation(
            @Valid @RequestBody NavigationEventRequest request) {

        requireEnabled();

        NavigationEvent event;
        try {
            event = request.toEvent();
        } catch (IllegalArgumentException e) {
            metricsConfig.getSkippedItems().increment();
            log.warn("Rejecting navigation event for session {}: {}", request.getSessionId(), e.getMessage());
            throw e;
        }

        boolean enqueued = ingestionQueue.enqueue(
                new IngestionWorkItem.NavigationEventWorkItem(event, sessionTracker.getGeneration()),
                ingestionConfig.getTimeout().getEnqueueMs());

        if (!enqueued) {
            log.warn("Ingestion queue full, rejecting navigation event: sessionId={}", event.sessionId());
            return queueFullResponse();
        }

        log.debug("Navigation event accepted: sessionId={}, type={}",
                event.sessionId(), event.navigationType().getValue());
        return ResponseEntity.accepted()
                .body(ApiResponse.success(event.sessionId()));
    }

    // ==================== Response Builders ====================

    private <T> ResponseEntity<ApiResponse<T>> queueFullResponse() {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(ApiResponse.queueFull(ingestionQueue.getUtilizationPercent()));
    }

    private void requireEnabled() {
        if (!wardConfig.isEnabled()) {
            throw IngestionException.disabled();
        }
    }
}
