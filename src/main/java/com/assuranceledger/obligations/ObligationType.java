package com.assuranceledger.obligations;

/**
 * Semantic requirement type for one obligation under a contract.
 */
public enum ObligationType {
    PAYMENT,
    SERVICE_DELIVERY,
    EVIDENCE_SUBMISSION,
    INSPECTION_PASS,
    APPROVAL,
    CUSTOM
}
