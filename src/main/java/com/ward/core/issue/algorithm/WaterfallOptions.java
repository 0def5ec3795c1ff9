package com.ward.core.issue.algorithm;

/**
 * Thresholds for sequential chain detection.
 *
 * @param minGapMs       overlap tolerated between consecutive chain members
 * @param minChainLength shortest chain reported
 * @param minWastedMs    least wasted time reported
 */
public record WaterfallOptions(double minGapMs, int minChainLength, double minWastedMs) {

    public static final WaterfallOptions DEFAULTS = new WaterfallOptions(5, 2, 50);

    public WaterfallOptions withMinChainLength(int minChainLength) {
        return new WaterfallOptions(minGapMs, minChainLength, minWastedMs);
    }

    public WaterfallOptions withMinWastedMs(double minWastedMs) {
        return new WaterfallOptions(minGapMs, minChainLength, minWastedMs);
    }
}
