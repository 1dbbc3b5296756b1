package com.assuranceledger.ledger;

/**
 * Lifecycle states for a secured balance account.
 */
public enum AccountStatus {
    /**
     * Accepts postings.
     */
    OPEN,

    /**
     * No further postings. Requires a zero held balance.
     */
    CLOSED
}
