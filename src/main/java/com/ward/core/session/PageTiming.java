package com.ward.core.session;

import lombok.Builder;

/**
 * Session timing on a single axis, in milliseconds.
 *
 * Browser marks have been re-anchored onto the server clock; absent marks are null.
 */
@Builder
public record PageTiming(
        double navigationStart,
        Double serverStart,
        Double serverEnd,
        Double responseStart,
        Double domContentLoaded,
        Double load,
        Double fcp,
        Double lcp,
        Double spaLcp
) {
}
