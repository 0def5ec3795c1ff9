package com.ward.core.span;

import java.util.Locale;
import java.util.Map;

/**
 * Turns a loosely populated span into a well-formed {@link RawSpan}.
 *
 * Fills category and the session/project/request tags from attributes when they
 * were not given explicitly, and clamps the end time so that duration is never negative.
 */
public class SpanNormalizer {

    /**
     * Normalizes a span draft.
     *
     * @param draft span with at least id, traceId, name and origin set
     * @return the normalized span
     * @throws InvalidSpanException if a required field is missing
     */
    public RawSpan normalize(RawSpan draft) {
        validate(draft);

        Map<String, Object> attributes = draft.attributes();
        double startTime = draft.startTime();
        double endTime = Math.max(draft.endTime(), startTime);

        return draft.toBuilder()
                .parentId(blankToNull(draft.parentId()))
                .category(resolveCategory(draft))
                .startTime(startTime)
                .endTime(endTime)
                .duration(endTime - startTime)
                .sessionId(firstTag(draft.sessionId(), attributes, SpanAttributes.SESSION_ID))
                .projectId(firstTag(draft.projectId(), attributes, SpanAttributes.PROJECT_ID))
                .requestId(firstTag(draft.requestId(), attributes, SpanAttributes.REQUEST_ID))
                .build();
    }

    // ==================== Validation ====================

    private void validate(RawSpan draft) {
        if (isBlank(draft.id())) {
            throw new InvalidSpanException("Span id is required", null);
        }
        if (isBlank(draft.traceId())) {
            throw new InvalidSpanException("Span traceId is required", draft.id());
        }
        if (draft.name() == null) {
            throw new InvalidSpanException("Span name is required", draft.id());
        }
        if (draft.origin() == null) {
            throw new InvalidSpanException("Span origin is required", draft.id());
        }
        if (Double.isNaN(draft.startTime()) || Double.isNaN(draft.endTime())) {
            throw new InvalidSpanException("Span times must be numbers", draft.id());
        }
    }

    // ==================== Category ====================

    private SpanCategory resolveCategory(RawSpan draft) {
        if (draft.category() != null) {
            return draft.category();
        }
        return SpanAttributes.string(draft.attributes(), SpanAttributes.SPAN_CATEGORY)
                .flatMap(SpanCategory::lookup)
                .orElseGet(() -> inferCategory(draft.name(), draft.attributes()));
    }

    /**
     * Infers a category from the span name and well-known attributes, first match wins.
     */
    SpanCategory inferCategory(String name, Map<String, Object> attributes) {
        String lower = name.toLowerCase(Locale.ROOT);

        if (SpanAttributes.isTruthy(attributes.get(SpanAttributes.HTTP_METHOD))
                || SpanAttributes.isTruthy(attributes.get(SpanAttributes.HTTP_REQUEST_METHOD))
                || lower.contains("fetch")
                || lower.contains("http")) {
            return SpanCategory.HTTP;
        }
        if (SpanAttributes.isTruthy(attributes.get(SpanAttributes.DB_SYSTEM))
                || lower.contains("database")
                || lower.contains("query")
                || lower.contains("prisma")) {
            return SpanCategory.DATABASE;
        }
        if (lower.contains("cache") || attributes.containsKey(SpanAttributes.CACHE_HIT)) {
            return SpanCategory.CACHE;
        }
        if (lower.contains("render") || lower.contains("rsc") || lower.contains("component")) {
            return SpanCategory.RENDER;
        }
        if (lower.contains("hydrat")) {
            return SpanCategory.HYDRATION;
        }
        if (lower.contains("middleware")) {
            return SpanCategory.MIDDLEWARE;
        }
        if (SpanAttributes.isTruthy(attributes.get(SpanAttributes.PEER_SERVICE))
                || SpanAttributes.isTruthy(attributes.get(SpanAttributes.NET_PEER_NAME))) {
            return SpanCategory.EXTERNAL;
        }
        return SpanCategory.OTHER;
    }

    // ==================== Helpers ====================

    private static String firstTag(String explicit, Map<String, Object> attributes, String key) {
        if (!isBlank(explicit)) {
            return explicit;
        }
        return SpanAttributes.string(attributes, key)
                .filter(value -> !value.isBlank())
                .orElse(null);
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
