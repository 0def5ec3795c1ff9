package com.ward.core.issue;

import com.ward.core.session.Resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One occurrence of an issue in a session.
 *
 * @param issueId   id of the matching {@link IssueDefinition}
 * @param severity  severity computed from the impact
 * @param resources resources involved
 * @param impact    quantified impact
 * @param context   detector-specific details, keyed by name
 */
public record IssueMatch(
        String issueId,
        IssueSeverity severity,
        List<Resource> resources,
        IssueImpact impact,
        Map<String, Object> context
) {

    public IssueMatch {
        resources = resources == null ? List.of() : List.copyOf(resources);
        // context values may be null, so Map.copyOf is not an option
        context = context == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public <T> T contextValue(String key, Class<T> type) {
        Object value = context.get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }
}
