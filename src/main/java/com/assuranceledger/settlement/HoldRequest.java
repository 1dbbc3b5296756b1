package com.assuranceledger.settlement;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator request to move available balance into held.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HoldRequest {

    private String tenantId;

    private String accountId;

    private long amount;

    private String idempotencyKey;

    private String reasonCode;

    private String notes;
}
