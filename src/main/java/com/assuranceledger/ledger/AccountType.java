package com.assuranceledger.ledger;

/**
 * Secured balance account category.
 */
public enum AccountType {
    ESCROW,
    RETAINAGE,
    DEPOSIT,
    ASSURANCE,
    CUSTOM
}
