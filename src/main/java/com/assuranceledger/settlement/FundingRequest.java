package com.assuranceledger.settlement;

import com.assuranceledger.subjects.SubjectRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Confirmation from a funding source that money was received against an account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FundingRequest {

    private String tenantId;

    private String accountId;

    /**
     * Amount received, in minor units of the account currency.
     */
    private long amount;

    /**
     * Currency of the received money. Optional; when present it must match the account.
     */
    private String currency;

    /**
     * Idempotency key to prevent duplicate processing. Required: funding confirmations
     * are delivered at least once.
     */
    private String idempotencyKey;

    /**
     * Payment-processor transaction that moved the money.
     */
    private String externalTransactionId;

    private SubjectRef sourceSubject;

    private String notes;
}
