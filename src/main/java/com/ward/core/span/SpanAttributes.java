package com.ward.core.span;

import java.util.Map;
import java.util.Optional;

/**
 * Attribute keys read from spans, and typed accessors over the flat attribute map.
 *
 * The propagation keys must match what the instrumentation layer writes, byte for byte.
 */
public final class SpanAttributes {

    // ==================== Propagation Keys ====================

    public static final String REQUEST_ID = "nextdoctor.request.id";
    public static final String SESSION_ID = "nextdoctor.session.id";
    public static final String PROJECT_ID = "nextdoctor.project.id";
    public static final String SPAN_CATEGORY = "nextdoctor.span.category";
    public static final String FETCH_INITIATOR = "ward.fetch.initiator";
    public static final String REQUEST_URL = "ward.request.url";
    public static final String REQUEST_ROUTE = "ward.request.route";

    // ==================== Semantic Convention Keys ====================

    public static final String URL_FULL = "url.full";
    public static final String URL_PATH = "url.path";
    public static final String HTTP_URL = "http.url";
    public static final String HTTP_TARGET = "http.target";
    public static final String HTTP_ROUTE = "http.route";
    public static final String HTTP_METHOD = "http.method";
    public static final String HTTP_REQUEST_METHOD = "http.request.method";
    public static final String HTTP_RESPONSE_STATUS_CODE = "http.response.status_code";
    public static final String HTTP_STATUS_CODE = "http.status_code";
    public static final String HTTP_RESPONSE_BODY_SIZE = "http.response.body.size";
    public static final String HTTP_RESPONSE_CONTENT_LENGTH = "http.response_content_length";
    public static final String HTTP_CACHE_STATUS = "http.cache.status";
    public static final String CACHE_HIT = "cache.hit";
    public static final String DB_SYSTEM = "db.system";
    public static final String PEER_SERVICE = "peer.service";
    public static final String NET_PEER_NAME = "net.peer.name";

    // ==================== Framework Keys ====================

    public static final String NEXTJS_KIND = "nextjs.kind";
    public static final String NEXTJS_ACTION = "nextjs.action";
    public static final String NEXTJS_CACHE = "nextjs.cache";
    public static final String NEXTJS_RSC_REQUEST = "nextjs.rsc.request";

    private SpanAttributes() {
    }

    // ==================== Accessors ====================

    /**
     * Returns the first non-null value among the given keys.
     */
    public static Object firstPresent(Map<String, Object> attributes, String... keys) {
        for (String key : keys) {
            Object value = attributes.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Returns the first non-null value among the given keys rendered as text, or the empty string.
     */
    public static String firstText(Map<String, Object> attributes, String... keys) {
        Object value = firstPresent(attributes, keys);
        return value == null ? "" : asText(value);
    }

    public static Optional<String> string(Map<String, Object> attributes, String key) {
        Object value = attributes.get(key);
        return value instanceof String text ? Optional.of(text) : Optional.empty();
    }

    public static Optional<Number> number(Object value) {
        return value instanceof Number n ? Optional.of(n) : Optional.empty();
    }

    public static boolean isTrue(Map<String, Object> attributes, String key) {
        return Boolean.TRUE.equals(attributes.get(key));
    }

    /**
     * Truthiness as the instrumentation layer emits it: absent, false, zero and empty text are false.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    /**
     * Renders an attribute value as text; integral doubles drop their fraction.
     */
    public static String asText(Object value) {
        if (value instanceof Double d && !d.isInfinite() && d == Math.rint(d)) {
            return String.valueOf(d.longValue());
        }
        if (value instanceof Float f && !f.isInfinite() && f == Math.rint(f)) {
            return String.valueOf(f.longValue());
        }
        return String.valueOf(value);
    }
}
