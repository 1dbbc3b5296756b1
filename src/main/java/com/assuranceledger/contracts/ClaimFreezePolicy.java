package com.assuranceledger.contracts;

/**
 * Which milestone releases a pending claim blocks.
 */
public enum ClaimFreezePolicy {
    /**
     * No release on the contract while any claim is pending.
     */
    FREEZE_ALL,

    /**
     * Only the milestone named by the claim is blocked. Claims without a milestone block nothing.
     */
    FREEZE_DISPUTED_MILESTONE,

    /**
     * Claims never block releases.
     */
    NONE
}
