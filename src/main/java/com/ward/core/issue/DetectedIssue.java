package com.ward.core.issue;

public record DetectedIssue(IssueDefinition definition, IssueMatch match, IssueSuggestion suggestion) {

    public IssueSeverity severity() {
        return match.severity();
    }

    public IssueCategory category() {
        return definition.category();
    }
}
