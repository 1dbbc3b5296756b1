package com.assuranceledger.ledger;

import com.assuranceledger.subjects.SubjectRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to append one entry to a secured balance account.
 *
 * The amount is a positive magnitude; {@link LedgerService} derives the signed balance and
 * held deltas from the entry type. Adjustments carry their signed deltas instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostingRequest {

    private String tenantId;

    private String accountId;

    private EntryType entryType;

    /**
     * Positive amount in minor units. Ignored for reversals, which negate the reversed entry,
     * and for adjustments, whose amount is the magnitude of their deltas.
     */
    private long amount;

    /**
     * Signed balance delta of an {@link EntryType#ADJUSTMENT}.
     */
    private long balanceDelta;

    /**
     * Signed held delta of an {@link EntryType#ADJUSTMENT}.
     */
    private long heldDelta;

    private String contractId;

    private String milestoneId;

    private String obligationId;

    private String externalTransactionId;

    private SubjectRef sourceSubject;

    /**
     * Entry negated by a {@link EntryType#REVERSAL}, or the disbursement an
     * {@link EntryType#ADJUSTMENT} corrects.
     */
    private String reversesEntryId;

    /**
     * Idempotency key to prevent duplicate processing. Unique per tenant.
     */
    private String idempotencyKey;

    private String reasonCode;

    private String notes;

    @Builder.Default
    private List<AllocationLine> allocations = new ArrayList<>();
}
