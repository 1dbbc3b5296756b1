package com.assuranceledger.ledger;

import lombok.Value;

import java.util.List;

/**
 * Outcome of a posting. {@code replayed} is set when the idempotency key had already been
 * used and the original entry is returned instead of a new one.
 */
@Value
public class PostingResult {
    LedgerEntry entry;
    List<SecuredBalanceAllocation> allocations;
    boolean replayed;
}
