package com.ward.core.session;

import java.util.List;
import java.util.function.Predicate;

/**
 * Decides which session ids are materialized as page sessions.
 */
public class SessionIdPolicy implements Predicate<String> {

    public static final List<String> DEFAULT_PREFIXES = List.of("nav_", "srv_");

    private final List<String> prefixes;

    public SessionIdPolicy(List<String> prefixes) {
        this.prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
    }

    public static SessionIdPolicy defaults() {
        return new SessionIdPolicy(DEFAULT_PREFIXES);
    }

    public static SessionIdPolicy acceptAll() {
        return new SessionIdPolicy(List.of());
    }

    @Override
    public boolean test(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        if (prefixes.isEmpty()) {
            return true;
        }
        return prefixes.stream().anyMatch(sessionId::startsWith);
    }

    public List<String> getPrefixes() {
        return prefixes;
    }
}
