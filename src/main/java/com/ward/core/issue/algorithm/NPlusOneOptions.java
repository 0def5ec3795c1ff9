package com.ward.core.issue.algorithm;

import com.ward.core.session.Resource;
import com.ward.core.session.ResourceType;

import java.util.Set;
import java.util.function.Function;

/**
 * Thresholds for N+1 detection.
 *
 * @param minCount         fewest repetitions reported
 * @param resourceTypes    resource types considered
 * @param patternExtractor maps a resource to its pattern; null selects the default URL normalization
 */
public record NPlusOneOptions(
        int minCount,
        Set<ResourceType> resourceTypes,
        Function<Resource, String> patternExtractor
) {

    public static final Set<ResourceType> DATA_FETCHING_TYPES =
            Set.of(ResourceType.FETCH, ResourceType.API, ResourceType.DATABASE, ResourceType.EXTERNAL);

    public static final NPlusOneOptions DEFAULTS = new NPlusOneOptions(3, DATA_FETCHING_TYPES, null);

    public NPlusOneOptions withMinCount(int minCount) {
        return new NPlusOneOptions(minCount, resourceTypes, patternExtractor);
    }

    public NPlusOneOptions withPatternExtractor(Function<Resource, String> patternExtractor) {
        return new NPlusOneOptions(minCount, resourceTypes, patternExtractor);
    }
}
