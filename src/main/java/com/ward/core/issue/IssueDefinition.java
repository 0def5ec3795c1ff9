package com.ward.core.issue;

/**
 * Static description of one kind of issue.
 *
 * @param id              stable identifier, e.g. {@code rsc:n-plus-1}
 * @param title           human-readable title
 * @param category        grouping category
 * @param defaultSeverity severity before impact is taken into account
 * @param docsUrl         documentation link, may be null
 */
public record IssueDefinition(
        String id,
        String title,
        IssueCategory category,
        IssueSeverity defaultSeverity,
        String docsUrl
) {
}
