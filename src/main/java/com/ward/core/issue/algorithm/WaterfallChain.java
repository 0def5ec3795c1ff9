package com.ward.core.issue.algorithm;

import com.ward.core.session.Resource;

import java.util.List;

/**
 * Resources that ran one after another although they could have overlapped.
 *
 * @param resources     chain members, ordered by start time
 * @param totalDuration sum of member durations
 * @param wastedTime    time saved if the members ran in parallel
 * @param depth         number of sequential steps
 */
public record WaterfallChain(List<Resource> resources, double totalDuration, double wastedTime, int depth) {

    public WaterfallChain {
        resources = List.copyOf(resources);
    }

    /**
     * Chain over sequential resources: wasted time is everything but the longest member.
     */
    static WaterfallChain of(List<Resource> resources) {
        double total = 0;
        double longest = 0;
        for (Resource resource : resources) {
            total += resource.duration();
            longest = Math.max(longest, resource.duration());
        }
        return new WaterfallChain(resources, total, total - longest, resources.size());
    }
}
