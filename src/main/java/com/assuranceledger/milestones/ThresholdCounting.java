package com.assuranceledger.milestones;

/**
 * What a threshold milestone counts toward its minimum.
 */
public enum ThresholdCounting {
    /**
     * Sum of the weights of satisfied links.
     */
    WEIGHT_SUM,

    /**
     * Number of satisfied links, weights ignored.
     */
    OBLIGATION_COUNT
}
