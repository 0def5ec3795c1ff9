package com.ward.core.issue;

import lombok.Builder;

/**
 * How to fix a detected issue.
 */
@Builder
public record IssueSuggestion(
        String summary,
        String explanation,
        CodeExample codeExample,
        String docsUrl,
        String estimatedImprovement
) {
}
