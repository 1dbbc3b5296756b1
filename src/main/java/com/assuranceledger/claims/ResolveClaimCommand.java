package com.assuranceledger.claims;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to resolve a claim. A positive settled amount on a money-moving resolution posts a
 * compensating ledger entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveClaimCommand {

    private String tenantId;

    private String claimId;

    private ResolutionType resolutionType;

    /**
     * Settled amount in minor units, at most the disputed amount.
     */
    private Long settledAmount;

    private String actor;

    private String note;
}
