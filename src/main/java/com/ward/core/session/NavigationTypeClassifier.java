package com.ward.core.session;

import com.ward.core.span.NavigationType;
import com.ward.core.span.RawSpan;
import com.ward.core.span.SpanAttributes;
import com.ward.core.span.SpanCategory;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Guesses how a session started when no navigation event says so.
 */
public final class NavigationTypeClassifier {

    private NavigationTypeClassifier() {
    }

    public static NavigationType classify(List<RawSpan> spans) {
        List<RawSpan> serverSpans = spans.stream().filter(RawSpan::isServer).toList();
        List<RawSpan> clientSpans = spans.stream().filter(RawSpan::isClient).toList();

        if (serverSpans.isEmpty() && !clientSpans.isEmpty()) {
            return NavigationType.NAVIGATION;
        }

        boolean rscRequest = serverSpans.stream().anyMatch(NavigationTypeClassifier::isRscRequest);
        boolean fullPageRender = serverSpans.stream().anyMatch(NavigationTypeClassifier::isFullPageRender);

        if (fullPageRender && !rscRequest) {
            return NavigationType.INITIAL;
        }
        if (rscRequest && !fullPageRender) {
            return NavigationType.NAVIGATION;
        }

        OptionalDouble earliestClient = clientSpans.stream().mapToDouble(RawSpan::startTime).min();
        OptionalDouble earliestServer = serverSpans.stream().mapToDouble(RawSpan::startTime).min();
        if (earliestClient.isPresent() && earliestServer.isPresent()
                && earliestClient.getAsDouble() < earliestServer.getAsDouble()) {
            return NavigationType.NAVIGATION;
        }
        return NavigationType.INITIAL;
    }

    private static boolean isRscRequest(RawSpan span) {
        return SpanAttributes.isTrue(span.attributes(), SpanAttributes.NEXTJS_RSC_REQUEST)
                || "rsc".equals(span.attribute(SpanAttributes.NEXTJS_KIND));
    }

    private static boolean isFullPageRender(RawSpan span) {
        return span.category() == SpanCategory.RENDER
                && "page".equals(span.attribute(SpanAttributes.NEXTJS_KIND));
    }
}
