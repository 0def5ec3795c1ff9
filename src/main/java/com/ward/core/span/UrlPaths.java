package com.ward.core.span;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * URL helpers shared by route extraction and the issue detectors.
 *
 * Relative references are resolved against {@code http://localhost/}.
 */
public final class UrlPaths {

    private static final URI BASE = URI.create("http://localhost/");

    private UrlPaths() {
    }

    /**
     * Host (with a non-default port) and raw path of a URL.
     */
    public record ParsedUrl(String host, String path) {

        public boolean isLocal() {
            return host.isEmpty() || host.contains("localhost") || host.contains("127.0.0.1");
        }
    }

    /**
     * Parses a URL or path.
     *
     * @param url absolute URL or reference relative to localhost
     * @return the parsed URL, or empty when the text is not a valid URI
     */
    public static Optional<ParsedUrl> parse(String url) {
        if (url == null) {
            return Optional.empty();
        }
        try {
            URI resolved = BASE.resolve(new URI(url));
            String path = resolved.getRawPath();
            if (path == null || path.isEmpty()) {
                path = "/";
            }
            return Optional.of(new ParsedUrl(hostOf(resolved), path));
        } catch (URISyntaxException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Text before the first {@code ?}.
     */
    public static String withoutQuery(String value) {
        int index = value.indexOf('?');
        return index < 0 ? value : value.substring(0, index);
    }

    public static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private static String hostOf(URI uri) {
        String host = uri.getHost();
        if (host == null) {
            return "";
        }
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("http".equalsIgnoreCase(uri.getScheme()) && port == 80)
                || ("https".equalsIgnoreCase(uri.getScheme()) && port == 443);
        return defaultPort ? host : host + ":" + port;
    }
}
