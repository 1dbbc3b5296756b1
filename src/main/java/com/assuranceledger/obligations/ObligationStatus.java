package com.assuranceledger.obligations;

/**
 * Lifecycle states for an obligation.
 */
public enum ObligationStatus {
    PENDING,

    /**
     * Work has started or the obligation is partially satisfied.
     */
    IN_PROGRESS,

    SATISFIED,

    /**
     * Terminal. Never counts toward milestone readiness.
     */
    BREACHED,

    WAIVED,

    CANCELLED,

    EXPIRED;

    public boolean isOpen() {
        return this == PENDING || this == IN_PROGRESS;
    }
}
