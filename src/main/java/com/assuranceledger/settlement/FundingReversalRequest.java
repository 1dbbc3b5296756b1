package com.assuranceledger.settlement;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to reverse a funding entry, e.g. after a chargeback.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FundingReversalRequest {

    private String tenantId;

    private String accountId;

    /**
     * The funding entry to reverse. The reversal always negates it in full.
     */
    private String fundingEntryId;

    /**
     * Idempotency key to prevent duplicate processing.
     */
    private String idempotencyKey;

    private String reasonCode;

    private String notes;
}
