package com.ward.core.session;

import com.ward.core.span.RawSpan;
import com.ward.core.span.SpanAttributes;
import com.ward.core.span.UrlPaths;

import java.util.List;
import java.util.Optional;

/**
 * Picks the route and URL that label a session, from spans sorted by start time.
 */
public final class RouteExtractor {

    static final String UNKNOWN_ROUTE = "/unknown";

    private RouteExtractor() {
    }

    public static String extractRoute(List<RawSpan> sortedSpans) {
        for (RawSpan span : sortedSpans) {
            Optional<String> path = SpanAttributes.string(span.attributes(), SpanAttributes.URL_PATH)
                    .filter(RouteExtractor::isConcretePath);
            if (path.isPresent()) {
                return path.get();
            }
        }

        for (RawSpan span : sortedSpans) {
            Object url = SpanAttributes.firstPresent(span.attributes(),
                    SpanAttributes.REQUEST_URL, SpanAttributes.URL_FULL, SpanAttributes.HTTP_URL);
            if (url instanceof String text && !text.isEmpty()) {
                String path = UrlPaths.parse(text)
                        .map(UrlPaths.ParsedUrl::path)
                        .orElseGet(() -> UrlPaths.withoutQuery(text));
                if (isConcretePath(path)) {
                    return path;
                }
            }
        }

        for (RawSpan span : sortedSpans) {
            Optional<String> target = SpanAttributes.string(span.attributes(), SpanAttributes.HTTP_TARGET)
                    .map(UrlPaths::withoutQuery)
                    .filter(RouteExtractor::isConcretePath);
            if (target.isPresent()) {
                return target.get();
            }
        }

        for (RawSpan span : sortedSpans) {
            Object route = SpanAttributes.firstPresent(span.attributes(),
                    SpanAttributes.REQUEST_ROUTE, SpanAttributes.HTTP_ROUTE);
            if (route instanceof String text && !text.isEmpty() && !"/".equals(text)) {
                return text;
            }
        }

        if (!sortedSpans.isEmpty()) {
            String name = sortedSpans.get(0).name();
            if (name.contains("/") && !name.startsWith("HTTP") && !name.startsWith("fetch")) {
                return UrlPaths.withoutQuery(name);
            }
        }
        return UNKNOWN_ROUTE;
    }

    public static String extractSessionUrl(List<RawSpan> sortedSpans) {
        for (RawSpan span : sortedSpans) {
            Object url = SpanAttributes.firstPresent(span.attributes(),
                    SpanAttributes.REQUEST_URL, SpanAttributes.URL_FULL, SpanAttributes.HTTP_URL);
            if (SpanAttributes.isTruthy(url)) {
                return SpanAttributes.asText(url);
            }
        }
        return sortedSpans.isEmpty() ? UNKNOWN_ROUTE : sortedSpans.get(0).name();
    }

    private static boolean isConcretePath(String path) {
        return !path.isEmpty() && !"/".equals(path) && !path.contains("[");
    }
}
