package com.ward.core.issue.algorithm;

import com.ward.core.session.Resource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds resources that ran sequentially when they could have run in parallel.
 */
public final class WaterfallAnalysis {

    /** Largest gap (ms) between consecutive resources that still counts as back-to-back. */
    static final double MAX_SEQUENTIAL_GAP_MS = 100;

    /** Children starting this close (ms) to the parent's end count as blocked by it. */
    static final double PARENT_BLOCK_TOLERANCE_MS = 10;

    private static final Comparator<WaterfallChain> MOST_WASTED_FIRST =
            Comparator.comparingDouble(WaterfallChain::wastedTime).reversed();

    private WaterfallAnalysis() {
    }

    /**
     * Scans resources in start order for runs where each one starts roughly when the previous ended.
     *
     * @return qualifying chains, most wasted time first
     */
    public static List<WaterfallChain> detectWaterfalls(List<Resource> resources, WaterfallOptions options) {
        if (resources.size() < options.minChainLength()) {
            return List.of();
        }

        List<Resource> sorted = new ArrayList<>(resources);
        sorted.sort(Comparator.comparingDouble(Resource::startTime));

        List<WaterfallChain> chains = new ArrayList<>();
        List<Resource> current = new ArrayList<>();

        for (Resource resource : sorted) {
            if (current.isEmpty()) {
                current.add(resource);
                continue;
            }

            Resource last = current.get(current.size() - 1);
            double gap = resource.startTime() - last.endTime();
            if (gap >= -options.minGapMs() && gap <= MAX_SEQUENTIAL_GAP_MS) {
                current.add(resource);
            } else {
                closeChain(current, options, chains);
                current = new ArrayList<>();
                current.add(resource);
            }
        }
        closeChain(current, options, chains);

        chains.sort(MOST_WASTED_FIRST);
        return chains;
    }

    public static List<WaterfallChain> detectWaterfalls(List<Resource> resources) {
        return detectWaterfalls(resources, WaterfallOptions.DEFAULTS);
    }

    private static void closeChain(List<Resource> members, WaterfallOptions options, List<WaterfallChain> chains) {
        if (members.size() < options.minChainLength()) {
            return;
        }
        WaterfallChain chain = WaterfallChain.of(members);
        if (chain.wastedTime() >= options.minWastedMs()) {
            chains.add(chain);
        }
    }

    /**
     * Finds the parent whose completion most delays one of its children.
     *
     * @param rootResources session forest
     * @return the pair with the largest wasted time, as a two-element chain
     */
    public static Optional<WaterfallChain> detectParentChildWaterfall(List<Resource> rootResources) {
        List<WaterfallChain> pairs = new ArrayList<>();
        for (Resource root : rootResources) {
            collectBlockedPairs(root, pairs);
        }
        return pairs.stream().sorted(MOST_WASTED_FIRST).findFirst();
    }

    private static void collectBlockedPairs(Resource parent, List<WaterfallChain> pairs) {
        Resource longestBlocked = null;
        for (Resource child : parent.children()) {
            boolean blocked = child.startTime() >= parent.endTime() - PARENT_BLOCK_TOLERANCE_MS;
            if (blocked && (longestBlocked == null || child.duration() > longestBlocked.duration())) {
                longestBlocked = child;
            }
        }

        if (longestBlocked != null) {
            pairs.add(new WaterfallChain(
                    List.of(parent, longestBlocked),
                    parent.duration() + longestBlocked.duration(),
                    Math.min(parent.duration(), longestBlocked.duration()),
                    2));
        }

        for (Resource child : parent.children()) {
            collectBlockedPairs(child, pairs);
        }
    }

    /**
     * Runs chain detection separately for each initiating source file.
     *
     * @return chains from all initiators, most wasted time first
     */
    public static List<WaterfallChain> detectSequentialByInitiator(List<Resource> resources) {
        Map<String, List<Resource>> byInitiator = new LinkedHashMap<>();
        for (Resource resource : resources) {
            if (resource.initiator() != null) {
                byInitiator.computeIfAbsent(resource.initiator(), key -> new ArrayList<>()).add(resource);
            }
        }

        WaterfallOptions options = WaterfallOptions.DEFAULTS.withMinChainLength(2).withMinWastedMs(30);
        List<WaterfallChain> chains = new ArrayList<>();
        for (List<Resource> group : byInitiator.values()) {
            if (group.size() >= 2) {
                chains.addAll(detectWaterfalls(group, options));
            }
        }

        chains.sort(MOST_WASTED_FIRST);
        return chains;
    }

    public static double calculatePotentialSavings(List<WaterfallChain> chains) {
        return chains.stream().mapToDouble(WaterfallChain::wastedTime).sum();
    }
}
