package com.assuranceledger.claims;

import java.util.List;

/**
 * Claim lifecycle states.
 */
public enum ClaimStatus {
    OPEN,
    IN_REVIEW,
    ESCALATED,
    RESOLVED,
    CLOSED,
    REJECTED,
    CANCELLED;

    /**
     * Whether the claim still holds its contract in dispute.
     */
    public boolean isPending() {
        return this != CLOSED && this != REJECTED && this != CANCELLED;
    }

    /**
     * Whether the claim can still be resolved, rejected or cancelled.
     */
    public boolean isUnresolved() {
        return this == OPEN || this == IN_REVIEW || this == ESCALATED;
    }

    public static List<ClaimStatus> pendingStatuses() {
        return List.of(OPEN, IN_REVIEW, ESCALATED, RESOLVED);
    }
}
