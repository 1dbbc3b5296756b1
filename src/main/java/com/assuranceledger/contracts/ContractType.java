package com.assuranceledger.contracts;

/**
 * High-level commitment contract family.
 */
public enum ContractType {
    ESCROW,
    RETAINAGE,
    SERVICE,
    PAYMENT_ASSURANCE,
    /**
     * Tenant-defined family; the contract carries a {@code custom_*} code.
     */
    CUSTOM
}
