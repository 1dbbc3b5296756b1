package com.assuranceledger.ledger;

/**
 * Posting state of a ledger entry.
 */
public enum EntryStatus {
    /**
     * Applied to the account snapshot.
     */
    POSTED,

    /**
     * Applied, and negated by a later {@link EntryType#REVERSAL} entry. Both still count in the fold.
     */
    REVERSED,

    /**
     * Reserved for entries imported from an external ledger that never took effect; the posting
     * primitive never writes it, since every entry it appends is folded in the same transaction.
     * Excluded from the fold.
     */
    VOIDED
}
