package com.assuranceledger.milestones;

/**
 * How a milestone aggregates its linked obligations into a release decision.
 */
public enum EvaluationMode {
    /**
     * Every required link is satisfied.
     */
    ALL,

    /**
     * At least one required link is satisfied.
     */
    ANY,

    /**
     * Satisfied links reach the milestone's minimum satisfied count.
     */
    THRESHOLD
}
