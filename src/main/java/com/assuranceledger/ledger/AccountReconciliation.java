package com.assuranceledger.ledger;

import lombok.Value;

/**
 * Comparison of an account snapshot with the fold of its non-voided ledger entries.
 */
@Value
public class AccountReconciliation {
    String accountId;
    long snapshotBalance;
    long snapshotHeld;
    long foldedBalance;
    long foldedHeld;
    long entryCount;

    public boolean isConsistent() {
        return snapshotBalance == foldedBalance && snapshotHeld == foldedHeld;
    }
}
