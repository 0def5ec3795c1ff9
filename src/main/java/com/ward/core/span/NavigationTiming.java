package com.ward.core.span;

/**
 * Browser navigation marks, relative to the browser's own navigation start.
 */
public record NavigationTiming(
        double navigationStart,
        Double responseStart,
        Double domContentLoaded,
        Double load,
        Double fcp,
        Double lcp
) {

    public static NavigationTiming startingAt(double navigationStart) {
        return new NavigationTiming(navigationStart, null, null, null, null, null);
    }
}
