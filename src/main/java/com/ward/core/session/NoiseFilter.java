package com.ward.core.session;

import com.ward.core.span.RawSpan;
import com.ward.core.span.SpanAttributes;

import java.util.List;
import java.util.Locale;

/**
 * Drops framework internals, analytics beacons and static assets before a session is built.
 */
public final class NoiseFilter {

    static final List<String> NOISE_PATTERNS = List.of(
            "__nextjs_original-stack-frame",
            "_next/static",
            "_next/image",
            "/g/collect",
            "google-analytics",
            "googletagmanager",
            "favicon.ico",
            ".ico",
            ".png",
            ".jpg",
            ".svg",
            ".woff",
            ".css"
    );

    private NoiseFilter() {
    }

    public static boolean isNoise(RawSpan span) {
        String name = span.name().toLowerCase(Locale.ROOT);
        String url = SpanAttributes.firstText(span.attributes(),
                SpanAttributes.URL_FULL, SpanAttributes.HTTP_URL, SpanAttributes.HTTP_TARGET)
                .toLowerCase(Locale.ROOT);

        for (String pattern : NOISE_PATTERNS) {
            if (name.contains(pattern) || url.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
