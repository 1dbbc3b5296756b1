package com.assuranceledger.settlement;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator correction of an account, posted as a compensating entry with signed deltas.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustmentRequest {

    private String tenantId;

    private String accountId;

    private long balanceDelta;

    private long heldDelta;

    /**
     * Release, forfeit or refund entry being corrected. Optional; when present the restored held
     * amount is taken back out of the contract's disbursement totals.
     */
    private String correctsEntryId;

    private String idempotencyKey;

    /**
     * Required. Ledger reading tools group corrections by it.
     */
    private String reasonCode;

    /**
     * External reference for standalone accounts, which have no contract to point at.
     */
    private String externalReference;

    private String actor;

    private String notes;
}
