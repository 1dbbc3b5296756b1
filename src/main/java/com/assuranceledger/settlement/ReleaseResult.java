package com.assuranceledger.settlement;

import com.assuranceledger.ledger.LedgerEntry;
import com.assuranceledger.ledger.SecuredBalanceAllocation;
import com.assuranceledger.milestones.Milestone;
import lombok.Value;

import java.util.List;

/**
 * Result of a milestone release. {@code entry} is {@code null} for zero-amount milestones.
 */
@Value
public class ReleaseResult {

    public enum Outcome {
        RELEASED,
        ALREADY_RELEASED
    }

    Outcome outcome;
    Milestone milestone;
    LedgerEntry entry;
    List<SecuredBalanceAllocation> allocations;

    public boolean isAlreadyReleased() {
        return outcome == Outcome.ALREADY_RELEASED;
    }
}
