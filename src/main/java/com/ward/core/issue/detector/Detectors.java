package com.ward.core.issue.detector;

import com.ward.core.issue.IssueDetector;

import java.util.List;

/**
 * Built-in detector sets. {@link #ALL} fixes the order detectors run in.
 */
public final class Detectors {

    public static final IssueDetector PARENT_CHILD_WATERFALL = new ParentChildWaterfallDetector();
    public static final IssueDetector SEQUENTIAL_AWAITS = new SequentialAwaitsDetector();
    public static final IssueDetector N_PLUS_ONE = new NPlusOneDetector();
    public static final IssueDetector UNCACHED_FETCH = new UncachedFetchDetector();

    public static final List<IssueDetector> ALL =
            List.of(PARENT_CHILD_WATERFALL, SEQUENTIAL_AWAITS, N_PLUS_ONE, UNCACHED_FETCH);

    public static final List<IssueDetector> WATERFALL = List.of(PARENT_CHILD_WATERFALL, SEQUENTIAL_AWAITS);

    public static final List<IssueDetector> CACHING = List.of(UNCACHED_FETCH);

    public static final List<IssueDetector> DATA_FETCHING = List.of(N_PLUS_ONE);

    private Detectors() {
    }
}
