package com.assuranceledger.contracts;

/**
 * What happens to funds still held when a contract is cancelled.
 */
public enum CancellationPolicy {
    /**
     * Held funds go to the counterparty as a forfeit.
     */
    FORFEIT_HELD,

    /**
     * Held funds are released as if every remaining milestone had passed.
     */
    RELEASE_HELD,

    /**
     * Held funds are returned to the funder.
     */
    REFUND_HELD
}
