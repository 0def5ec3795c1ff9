package com.ward.core.session;

import com.ward.core.span.NavigationEvent;
import com.ward.core.span.NavigationTiming;
import com.ward.core.span.NavigationType;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Derives {@link PageTiming} for a session and aligns browser marks to the span timeline.
 *
 * Browser marks are relative to the browser's own navigation start. When the server finished
 * and the browser reported a positive response start, the marks are shifted so that response
 * start coincides with the first client span (or the server end when there is none).
 */
public final class PageTimingCalculator {

    private PageTimingCalculator() {
    }

    public static PageTiming compute(List<Resource> resources, NavigationEvent event, NavigationType navigationType) {
        OptionalDouble serverStart = resources.stream()
                .filter(Resource::isServer).mapToDouble(Resource::startTime).min();
        OptionalDouble serverEnd = resources.stream()
                .filter(Resource::isServer).mapToDouble(Resource::endTime).max();
        OptionalDouble firstClientStart = resources.stream()
                .filter(resource -> !resource.isServer()).mapToDouble(Resource::startTime).min();

        double navigationStart = resources.stream()
                .mapToDouble(Resource::startTime).min()
                .orElse(serverStart.orElse(0));

        PageTiming.PageTimingBuilder timing = PageTiming.builder()
                .navigationStart(navigationStart)
                .serverStart(boxed(serverStart))
                .serverEnd(boxed(serverEnd));

        NavigationTiming marks = event == null ? null : event.timing();
        if (serverEnd.isPresent() && marks != null
                && marks.responseStart() != null && marks.responseStart() > 0) {
            double anchor = firstClientStart.orElse(serverEnd.getAsDouble());
            double browserStart = marks.responseStart();

            timing.responseStart(anchor)
                    .domContentLoaded(shift(marks.domContentLoaded(), anchor, browserStart))
                    .load(shift(marks.load(), anchor, browserStart))
                    .fcp(shift(marks.fcp(), anchor, browserStart))
                    .lcp(shift(marks.lcp(), anchor, browserStart));
        }

        if (navigationType != null && navigationType.isSoftNavigation()) {
            timing.spaLcp(spaLcp(resources, navigationStart));
        }
        return timing.build();
    }

    /**
     * Timing for a session known only through its navigation event.
     */
    public static PageTiming fromEvent(NavigationEvent event) {
        NavigationTiming marks = event.timing();
        return PageTiming.builder()
                .navigationStart(marks.navigationStart())
                .responseStart(marks.responseStart())
                .domContentLoaded(marks.domContentLoaded())
                .load(marks.load())
                .fcp(marks.fcp())
                .lcp(marks.lcp())
                .build();
    }

    private static Double spaLcp(List<Resource> resources, double navigationStart) {
        OptionalDouble lastRscEnd = resources.stream()
                .filter(resource -> resource.type() == ResourceType.RSC
                        || resource.name().contains("_rsc")
                        || resource.url().contains("_rsc"))
                .mapToDouble(Resource::endTime)
                .max();
        return lastRscEnd.isPresent() ? lastRscEnd.getAsDouble() - navigationStart : null;
    }

    private static Double shift(Double mark, double anchor, double browserStart) {
        return mark == null ? null : anchor + (mark - browserStart);
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
