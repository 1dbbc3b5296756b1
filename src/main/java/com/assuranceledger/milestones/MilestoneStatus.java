package com.assuranceledger.milestones;

/**
 * Milestone lifecycle states.
 */
public enum MilestoneStatus {
    PENDING,
    READY,
    RELEASED,
    SKIPPED,
    CANCELLED;

    /**
     * Whether evaluation may still move the milestone between pending and ready.
     */
    public boolean isEvaluable() {
        return this == PENDING || this == READY;
    }
}
