package com.assuranceledger.ledger;

import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.subjects.SubjectRef;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable posting against one secured balance account.
 *
 * Ledger entries are never updated or deleted - they are append-only. The single exception is
 * the status flag of a funding entry that a later reversal entry negates.
 */
@Entity
@Table(name = "secured_balance_ledger_entries",
    uniqueConstraints = @UniqueConstraint(name = "uk_ledger_idempotency", columnNames = {"tenant_id", "idempotency_key"}),
    indexes = {
        @Index(name = "idx_ledger_account_occurred", columnList = "tenant_id, account_id, occurred_at"),
        @Index(name = "idx_ledger_contract", columnList = "tenant_id, contract_id")
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerEntry {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EntryType entryType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EntryStatus status;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(length = 3, nullable = false, updatable = false)
    private String currency;

    @Column(nullable = false, updatable = false)
    private long balanceDelta;

    @Column(nullable = false, updatable = false)
    private long heldDelta;

    @Column(name = "contract_id", updatable = false)
    private String contractId;

    @Column(updatable = false)
    private String milestoneId;

    @Column(updatable = false)
    private String obligationId;

    /**
     * Payment-processor transaction or other external reference that produced the entry.
     */
    @Column(updatable = false)
    private String externalTransactionId;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "source_subject_kind", updatable = false)),
        @AttributeOverride(name = "id", column = @Column(name = "source_subject_id", updatable = false))
    })
    private SubjectRef sourceSubject;

    @Column(updatable = false)
    private String reversesEntryId;

    @Column(name = "idempotency_key", length = 200, updatable = false)
    private String idempotencyKey;

    @Column(updatable = false)
    private String reasonCode;

    @Column(length = 2000, updatable = false)
    private String notes;

    LedgerEntry(PostingRequest request, String currency, long balanceDelta, long heldDelta) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = request.getTenantId();
        this.accountId = request.getAccountId();
        this.entryType = request.getEntryType();
        this.status = EntryStatus.POSTED;
        this.occurredAt = Instant.now();
        this.currency = currency;
        this.balanceDelta = balanceDelta;
        this.heldDelta = heldDelta;
        this.contractId = request.getContractId();
        this.milestoneId = request.getMilestoneId();
        this.obligationId = request.getObligationId();
        this.externalTransactionId = request.getExternalTransactionId();
        this.sourceSubject = request.getSourceSubject();
        this.reversesEntryId = request.getReversesEntryId();
        this.idempotencyKey = request.getIdempotencyKey();
        this.reasonCode = request.getReasonCode();
        this.notes = request.getNotes();
    }

    /**
     * Magnitude of the entry: the held movement, or the balance movement for held-neutral entries.
     */
    public long getAmount() {
        return heldDelta != 0 ? Math.abs(heldDelta) : Math.abs(balanceDelta);
    }

    public boolean hasContext() {
        return contractId != null || milestoneId != null || obligationId != null
            || externalTransactionId != null || sourceSubject != null;
    }

    void markReversed() {
        if (status != EntryStatus.POSTED) {
            throw new InvalidStateException("ledger entry", id, status.name(), "reverse");
        }
        this.status = EntryStatus.REVERSED;
    }
}
