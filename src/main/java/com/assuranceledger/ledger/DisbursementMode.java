package com.assuranceledger.ledger;

/**
 * How release and forfeit entries move the account snapshot.
 */
public enum DisbursementMode {
    /**
     * Release/forfeit lower both balance and held: balance is money currently in the account.
     */
    BALANCE_AND_HELD,

    /**
     * Release/forfeit lower held only: balance stays the gross funded amount and
     * {@code released}/{@code forfeited} record what left.
     */
    HELD_ONLY
}
