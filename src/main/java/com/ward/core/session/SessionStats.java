package com.ward.core.session;

import java.util.List;

/**
 * Aggregate figures over the resources of one session.
 */
public record SessionStats(
        int totalResources,
        int serverResources,
        int clientResources,
        double totalDuration,
        int errorCount,
        int cachedCount,
        SlowestResource slowestResource
) {

    public static final SessionStats EMPTY = new SessionStats(0, 0, 0, 0, 0, 0, null);

    public record SlowestResource(String name, double duration) {
    }

    /**
     * Computes stats in one pass. Ties on duration keep the first resource seen.
     */
    public static SessionStats of(List<Resource> resources) {
        if (resources.isEmpty()) {
            return EMPTY;
        }

        int serverResources = 0;
        int clientResources = 0;
        int errorCount = 0;
        int cachedCount = 0;
        double minStartTime = resources.get(0).startTime();
        double maxEndTime = resources.get(0).endTime();
        Resource slowest = null;

        for (Resource resource : resources) {
            if (resource.isServer()) {
                serverResources++;
            } else {
                clientResources++;
            }
            if (resource.isError()) {
                errorCount++;
            }
            if (resource.cached()) {
                cachedCount++;
            }
            minStartTime = Math.min(minStartTime, resource.startTime());
            maxEndTime = Math.max(maxEndTime, resource.endTime());
            if (slowest == null || resource.duration() > slowest.duration()) {
                slowest = resource;
            }
        }

        return new SessionStats(
                resources.size(),
                serverResources,
                clientResources,
                maxEndTime - minStartTime,
                errorCount,
                cachedCount,
                new SlowestResource(slowest.name(), slowest.duration())
        );
    }
}
