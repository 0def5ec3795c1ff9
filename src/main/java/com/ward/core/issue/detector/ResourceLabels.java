package com.ward.core.issue.detector;

import com.ward.core.session.Resource;
import com.ward.core.span.UrlPaths;

/**
 * Short display labels for resources in suggestion text.
 */
final class ResourceLabels {

    private ResourceLabels() {
    }

    /**
     * The name when short, otherwise a truncated path.
     */
    static String name(Resource resource) {
        if (resource.name().length() <= 40) {
            return resource.name();
        }
        return UrlPaths.parse(resource.urlOrName())
                .map(parsed -> UrlPaths.truncate(parsed.path(), 40))
                .orElseGet(() -> UrlPaths.truncate(resource.name(), 40) + "...");
    }

    /**
     * The requested path without the method or {@code fetch} prefix, or its last segment.
     */
    static String fetchName(Resource resource) {
        String name = resource.name();
        if (name.startsWith("GET ")) {
            return slice(name, 4, 30);
        }
        if (name.startsWith("POST ")) {
            return slice(name, 5, 30);
        }
        if (name.startsWith("fetch ")) {
            return slice(name, 6, 30);
        }
        if (name.contains("/")) {
            String last = name.substring(name.lastIndexOf('/') + 1);
            if (!last.isEmpty() && last.length() < 30) {
                return last;
            }
        }
        return UrlPaths.truncate(name, 25);
    }

    /**
     * Host and path for remote URLs, path only for local ones.
     */
    static String url(Resource resource) {
        String url = resource.urlOrName();
        return UrlPaths.parse(url)
                .map(parsed -> !parsed.host().isEmpty() && !parsed.host().contains("localhost")
                        ? parsed.host() + UrlPaths.truncate(parsed.path(), 20)
                        : UrlPaths.truncate(parsed.path(), 30))
                .orElseGet(() -> UrlPaths.truncate(url, 30));
    }

    private static String slice(String value, int from, int to) {
        return value.substring(from, Math.min(to, value.length()));
    }
}
