package com.ward.core.session;

import com.ward.core.span.NavigationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Rebuilds page sessions in a {@link SessionState} from their spans and navigation events.
 */
@Slf4j
@RequiredArgsConstructor
public class SessionProcessor {

    private final SessionBuilder sessionBuilder;
    private final Predicate<String> sessionIdPolicy;

    /**
     * Rebuilds the given sessions and stores the results.
     *
     * @return every stored session, newest first
     */
    public List<PageSession> process(SessionState state, Collection<String> sessionIds) {
        for (String sessionId : sessionIds) {
            if (!sessionIdPolicy.test(sessionId)) {
                log.debug("Skipping session {}: id rejected by policy", sessionId);
                continue;
            }
            rebuild(state, sessionId);
        }
        return PageSession.sortNewestFirst(state.sessions());
    }

    /**
     * Rebuilds every session known through a span set or a navigation event.
     */
    public List<PageSession> processAll(SessionState state) {
        return process(state, state.knownSessionIds());
    }

    private void rebuild(SessionState state, String sessionId) {
        NavigationEvent event = state.getNavigationEvent(sessionId).orElse(null);

        if (state.hasSpanSet(sessionId)) {
            Optional<PageSession> session = sessionBuilder.build(sessionId, state.spansOf(sessionId), event);
            session.ifPresent(state::putSession);
            if (session.isEmpty()) {
                log.debug("Session {} has only noise spans", sessionId);
            }
        } else if (event != null && !state.hasSession(sessionId)) {
            state.putSession(sessionBuilder.buildEmpty(event));
        }
    }
}
