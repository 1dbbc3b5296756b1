package com.assuranceledger.claims;

import com.assuranceledger.ledger.AllocationType;
import com.assuranceledger.ledger.EntryType;

/**
 * How a claim was resolved, and which ledger entry a positive settled amount produces.
 */
public enum ResolutionType {
    RELEASE_FUNDS(EntryType.RELEASE, AllocationType.MILESTONE_RELEASE),
    REFUND(EntryType.REFUND, AllocationType.REFUND),
    FORFEIT(EntryType.FORFEIT, AllocationType.FORFEIT),
    PARTIAL_SETTLEMENT(EntryType.FORFEIT, AllocationType.FORFEIT),
    REWORK_REQUIRED(null, null),
    NO_ACTION(null, null),
    NO_FAULT(null, null),
    OTHER(null, null);

    private final EntryType settlementEntryType;
    private final AllocationType allocationType;

    ResolutionType(EntryType settlementEntryType, AllocationType allocationType) {
        this.settlementEntryType = settlementEntryType;
        this.allocationType = allocationType;
    }

    public EntryType getSettlementEntryType() {
        return settlementEntryType;
    }

    public AllocationType getAllocationType() {
        return allocationType;
    }

    public boolean postsSettlement() {
        return settlementEntryType != null;
    }
}
