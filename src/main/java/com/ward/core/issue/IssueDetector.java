package com.ward.core.issue;

import com.ward.core.session.PageSession;

import java.util.Optional;

/**
 * Looks for one kind of performance issue in a page session.
 *
 * Implementations are stateless and must not modify the session.
 */
public interface IssueDetector {

    IssueDefinition definition();

    /**
     * @return the match, or empty when the session does not exhibit the issue
     */
    Optional<IssueMatch> detect(PageSession session);

    IssueSuggestion suggest(IssueMatch match);
}
