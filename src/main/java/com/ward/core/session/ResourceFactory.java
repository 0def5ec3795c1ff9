package com.ward.core.session;

import com.ward.core.span.RawSpan;
import com.ward.core.span.SpanAttributes;
import com.ward.core.span.SpanCategory;

import java.util.Locale;
import java.util.Map;

/**
 * Converts raw spans into untreed {@link Resource}s.
 */
public final class ResourceFactory {

    private ResourceFactory() {
    }

    public static Resource fromSpan(RawSpan span, String sessionId, String projectId) {
        Map<String, Object> attributes = span.attributes();
        return Resource.builder()
                .id(span.id())
                .parentId(span.parentId())
                .sessionId(sessionId)
                .projectId(projectId)
                .type(inferType(span))
                .origin(span.origin())
                .name(span.name())
                .url(SpanAttributes.firstText(attributes,
                        SpanAttributes.REQUEST_URL, SpanAttributes.URL_FULL,
                        SpanAttributes.HTTP_URL, SpanAttributes.HTTP_TARGET))
                .startTime(span.startTime())
                .endTime(span.endTime())
                .duration(span.duration())
                .status(span.status())
                .statusCode(statusCode(attributes))
                .size(size(attributes))
                .cached(isCached(attributes))
                .initiator(SpanAttributes.string(attributes, SpanAttributes.FETCH_INITIATOR).orElse(null))
                .attributes(attributes)
                .build();
    }

    /**
     * Resource type from category, name and attributes. First match wins.
     */
    static ResourceType inferType(RawSpan span) {
        String name = span.name().toLowerCase(Locale.ROOT);
        SpanCategory category = span.category();

        if (category == SpanCategory.RENDER || name.contains("render")) {
            if (name.contains("rsc") || "rsc".equals(span.attribute(SpanAttributes.NEXTJS_KIND))) {
                return ResourceType.RSC;
            }
            return ResourceType.RENDER;
        }
        if (category == SpanCategory.HYDRATION || name.contains("hydrat")) {
            return ResourceType.HYDRATION;
        }
        if (category == SpanCategory.DATABASE) {
            return ResourceType.DATABASE;
        }
        if (category == SpanCategory.CACHE) {
            return ResourceType.CACHE;
        }
        if (category == SpanCategory.EXTERNAL) {
            return ResourceType.EXTERNAL;
        }
        if (SpanAttributes.isTruthy(span.attribute(SpanAttributes.NEXTJS_ACTION))) {
            return ResourceType.ACTION;
        }

        String url = SpanAttributes.firstText(span.attributes(), SpanAttributes.URL_FULL, SpanAttributes.HTTP_URL);
        if (url.contains("/api/") || name.contains("/api/")) {
            return ResourceType.API;
        }
        if (category == SpanCategory.HTTP) {
            return ResourceType.FETCH;
        }
        return ResourceType.OTHER;
    }

    private static Integer statusCode(Map<String, Object> attributes) {
        return SpanAttributes.number(SpanAttributes.firstPresent(attributes,
                        SpanAttributes.HTTP_RESPONSE_STATUS_CODE, SpanAttributes.HTTP_STATUS_CODE))
                .map(Number::intValue)
                .orElse(null);
    }

    private static Long size(Map<String, Object> attributes) {
        return SpanAttributes.number(SpanAttributes.firstPresent(attributes,
                        SpanAttributes.HTTP_RESPONSE_BODY_SIZE, SpanAttributes.HTTP_RESPONSE_CONTENT_LENGTH))
                .map(Number::longValue)
                .orElse(null);
    }

    private static boolean isCached(Map<String, Object> attributes) {
        Object cacheStatus = SpanAttributes.firstPresent(attributes,
                SpanAttributes.HTTP_CACHE_STATUS, SpanAttributes.NEXTJS_CACHE);
        if (cacheStatus instanceof String status) {
            return "HIT".equals(status) || "STALE".equals(status);
        }
        return SpanAttributes.isTrue(attributes, SpanAttributes.CACHE_HIT);
    }
}
