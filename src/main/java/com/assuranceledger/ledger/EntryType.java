package com.assuranceledger.ledger;

/**
 * Types of secured balance ledger entries.
 *
 * Each type fixes the sign of the balance and held deltas; see {@link LedgerService}.
 * {@link #ADJUSTMENT} is the exception: the operator supplies both signed deltas.
 */
public enum EntryType {
    /**
     * Money received against the contract. Increases balance and held.
     */
    FUND,

    /**
     * Moves available balance ({@code balance - held}) into held without new money arriving.
     */
    HOLD,

    /**
     * Held funds released to the counterparty when a milestone passes or a claim settles.
     */
    RELEASE,

    /**
     * Held funds forfeited, e.g. on cancellation or claim settlement.
     */
    FORFEIT,

    /**
     * Held funds returned to the funder.
     */
    REFUND,

    /**
     * Compensating entry negating a previously posted funding entry.
     */
    REVERSAL,

    /**
     * Operator correction with signed deltas. When it names a release, forfeit or refund entry,
     * the restored held amount is given back to the contract's committed budget.
     */
    ADJUSTMENT;

    /**
     * Whether the entry moves money out of held and counts against the contract's committed budget.
     */
    public boolean isDisbursement() {
        return this == RELEASE || this == FORFEIT || this == REFUND;
    }

    /**
     * Whether the caller supplies the deltas instead of a positive amount.
     */
    public boolean hasCallerDeltas() {
        return this == ADJUSTMENT;
    }
}
