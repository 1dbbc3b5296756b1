package com.assuranceledger.claims;

public enum ClaimEventType {
    OPENED,
    NOTE,
    EVIDENCE_ADDED,
    AMOUNT_UPDATED,
    REVIEW_STARTED,
    ESCALATED,
    RESOLVED,
    REJECTED,
    CANCELLED,
    CLOSED
}
