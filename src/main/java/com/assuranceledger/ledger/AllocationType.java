package com.assuranceledger.ledger;

/**
 * Reason an allocation row applies part of a ledger entry to a target.
 */
public enum AllocationType {
    OBLIGATION_SETTLEMENT,
    MILESTONE_RELEASE,
    REFUND,
    FORFEIT,
    ADJUSTMENT
}
