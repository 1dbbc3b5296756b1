package com.assuranceledger.contracts;

/**
 * Lifecycle states for a commitment contract.
 */
public enum ContractStatus {
    /**
     * Being drafted. Obligations and milestones can be added, nothing is enforced yet.
     */
    DRAFT,

    /**
     * In force. Obligations are evaluated and milestones may release.
     */
    ACTIVE,

    /**
     * Temporarily paused by an operator.
     */
    PAUSED,

    /**
     * At least one claim is pending. Entered and exited automatically by the claim workflow.
     */
    DISPUTED,

    COMPLETED,

    CANCELLED,

    DEFAULTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == DEFAULTED;
    }
}
