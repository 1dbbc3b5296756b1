package com.assuranceledger.claims;

public enum ClaimType {
    NON_DELIVERY,
    QUALITY,
    DAMAGE,
    BILLING,
    BREACH_OF_TERMS,
    CUSTOM
}
