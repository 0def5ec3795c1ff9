package com.ward.core.issue.algorithm;

import com.ward.core.session.Resource;

import java.util.List;

/**
 * A URL pattern requested repeatedly within one session.
 *
 * @param pattern       normalized URL, ids replaced by {@code *}
 * @param resources     matching resources
 * @param count         number of matching resources
 * @param totalDuration summed duration
 * @param avgDuration   mean duration
 * @param initiator     source file shared by every member, or null
 */
public record NPlusOnePattern(
        String pattern,
        List<Resource> resources,
        int count,
        double totalDuration,
        double avgDuration,
        String initiator
) {

    public NPlusOnePattern {
        resources = List.copyOf(resources);
    }
}
