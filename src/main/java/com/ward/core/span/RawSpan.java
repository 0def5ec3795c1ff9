package com.ward.core.span;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single timed operation as received from the client or server runtime.
 *
 * Times are milliseconds. Spans are never mutated after ingestion; a re-ingested
 * span with the same id replaces the stored one.
 */
@Builder(toBuilder = true)
public record RawSpan(
        String id,
        String parentId,
        String traceId,
        String name,
        SpanOrigin origin,
        SpanCategory category,
        double startTime,
        double endTime,
        double duration,
        SpanStatus status,
        Map<String, Object> attributes,
        String sessionId,
        String projectId,
        String requestId
) {

    public RawSpan {
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        if (status == null) {
            status = SpanStatus.UNSET;
        }
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public boolean isServer() {
        return origin == SpanOrigin.SERVER;
    }

    public boolean isClient() {
        return origin == SpanOrigin.CLIENT;
    }
}
