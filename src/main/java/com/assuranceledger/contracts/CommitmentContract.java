package com.assuranceledger.contracts;

import com.assuranceledger.common.exception.InsufficientSecuredFundsException;
import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.InvariantViolationException;
import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.ledger.EntryType;
import com.assuranceledger.subjects.SubjectRef;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Commitment contract: the agreement under which funds are secured pending conditions.
 *
 * Owns the aggregate committed/released/forfeited/refunded totals. The disbursement totals
 * only move through {@link #recordRelease}, {@link #recordForfeit} and {@link #recordRefund},
 * which the ledger posting primitive calls in the same transaction as the ledger append,
 * and {@link #correctDisbursement} for adjustments.
 */
@Entity
@Table(name = "commitment_contracts", indexes = {
    @Index(name = "idx_contract_tenant_status", columnList = "tenant_id, status"),
    @Index(name = "idx_contract_tenant_expires", columnList = "tenant_id, expires_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CommitmentContract {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ContractType contractType;

    /**
     * {@code custom_*} code, present iff {@link #contractType} is CUSTOM.
     */
    private String customTypeCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ContractStatus status;

    /**
     * Status to return to once every claim against the contract is settled.
     */
    @Enumerated(EnumType.STRING)
    private ContractStatus statusBeforeDispute;

    private String title;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "anchor_subject_kind", nullable = false)),
        @AttributeOverride(name = "id", column = @Column(name = "anchor_subject_id", nullable = false))
    })
    private SubjectRef anchorSubject;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "counterparty_subject_kind")),
        @AttributeOverride(name = "id", column = @Column(name = "counterparty_subject_id"))
    })
    private SubjectRef counterpartySubject;

    @Column(length = 3, nullable = false)
    private String currency;

    private long committedAmount;

    private long releasedAmount;

    private long forfeitedAmount;

    private long refundedAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CancellationPolicy cancellationPolicy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ClaimFreezePolicy claimFreezePolicy;

    private Instant startedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    private Instant completedAt;

    private Instant cancelledAt;

    private Instant defaultedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public CommitmentContract(String tenantId, ContractType contractType, String customTypeCode, String title,
                              SubjectRef anchorSubject, SubjectRef counterpartySubject, String currency,
                              long committedAmount, Instant startedAt, Instant expiresAt,
                              CancellationPolicy cancellationPolicy, ClaimFreezePolicy claimFreezePolicy) {
        if (startedAt != null && expiresAt != null && !expiresAt.isAfter(startedAt)) {
            throw new ValidationException("expiresAt", "must be after startedAt");
        }
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.contractType = contractType;
        this.customTypeCode = customTypeCode;
        this.title = title;
        this.anchorSubject = anchorSubject;
        this.counterpartySubject = counterpartySubject;
        this.currency = currency;
        this.committedAmount = committedAmount;
        this.startedAt = startedAt;
        this.expiresAt = expiresAt;
        this.cancellationPolicy = cancellationPolicy;
        this.claimFreezePolicy = claimFreezePolicy;
        this.status = ContractStatus.DRAFT;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public void activate() {
        requireStatus("activate", ContractStatus.DRAFT);
        Instant now = Instant.now();
        if (startedAt == null) {
            if (expiresAt != null && !expiresAt.isAfter(now)) {
                throw new ValidationException("expiresAt", "contract would expire before it starts");
            }
            startedAt = now;
        }
        transitionTo(ContractStatus.ACTIVE);
    }

    public void pause() {
        requireStatus("pause", ContractStatus.ACTIVE);
        transitionTo(ContractStatus.PAUSED);
    }

    public void resume() {
        requireStatus("resume", ContractStatus.PAUSED);
        transitionTo(ContractStatus.ACTIVE);
    }

    public void complete() {
        requireStatus("complete", ContractStatus.ACTIVE);
        completedAt = Instant.now();
        transitionTo(ContractStatus.COMPLETED);
    }

    public void cancel() {
        requireStatus("cancel", ContractStatus.DRAFT, ContractStatus.ACTIVE, ContractStatus.PAUSED);
        cancelledAt = Instant.now();
        transitionTo(ContractStatus.CANCELLED);
    }

    public void markDefaulted() {
        requireStatus("default", ContractStatus.ACTIVE, ContractStatus.PAUSED);
        defaultedAt = Instant.now();
        transitionTo(ContractStatus.DEFAULTED);
    }

    /**
     * Enter {@code DISPUTED}, remembering the state to return to. Re-entering is a no-op.
     */
    public void enterDispute() {
        if (status == ContractStatus.DISPUTED) {
            return;
        }
        requireStatus("dispute", ContractStatus.ACTIVE, ContractStatus.PAUSED);
        statusBeforeDispute = status;
        transitionTo(ContractStatus.DISPUTED);
    }

    public void exitDispute() {
        requireStatus("exit dispute", ContractStatus.DISPUTED);
        ContractStatus previous = statusBeforeDispute != null ? statusBeforeDispute : ContractStatus.ACTIVE;
        statusBeforeDispute = null;
        transitionTo(previous);
    }

    /**
     * Whether obligations may still be evaluated and milestones released.
     */
    public boolean isInForce() {
        return status == ContractStatus.ACTIVE || status == ContractStatus.DISPUTED;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Committed amount not yet released, forfeited or refunded.
     */
    public long getRemainingBudget() {
        return committedAmount - releasedAmount - forfeitedAmount - refundedAmount;
    }

    public void recordRelease(long amount) {
        requireBudget(amount);
        releasedAmount += amount;
        updatedAt = Instant.now();
    }

    public void recordForfeit(long amount) {
        requireBudget(amount);
        forfeitedAmount += amount;
        updatedAt = Instant.now();
    }

    public void recordRefund(long amount) {
        requireBudget(amount);
        refundedAmount += amount;
        updatedAt = Instant.now();
    }

    /**
     * Give back committed budget consumed by a release, forfeit or refund that an adjustment
     * corrected.
     */
    public void correctDisbursement(EntryType disbursement, long amount) {
        if (amount <= 0) {
            throw new ValidationException("amount", "must be > 0, got " + amount);
        }
        long total = switch (disbursement) {
            case RELEASE -> releasedAmount;
            case FORFEIT -> forfeitedAmount;
            case REFUND -> refundedAmount;
            default -> throw new IllegalArgumentException(disbursement + " is not a disbursement");
        };
        if (amount > total) {
            throw new InvariantViolationException(disbursement.name().toLowerCase() + " total >= 0",
                String.format("contract %s cannot correct %d of %d", id, amount, total));
        }
        switch (disbursement) {
            case RELEASE -> releasedAmount -= amount;
            case FORFEIT -> forfeitedAmount -= amount;
            default -> refundedAmount -= amount;
        }
        updatedAt = Instant.now();
    }

    public void setCancellationPolicy(CancellationPolicy cancellationPolicy) {
        this.cancellationPolicy = cancellationPolicy;
        this.updatedAt = Instant.now();
    }

    public void setClaimFreezePolicy(ClaimFreezePolicy claimFreezePolicy) {
        this.claimFreezePolicy = claimFreezePolicy;
        this.updatedAt = Instant.now();
    }

    private void requireBudget(long amount) {
        if (amount <= 0) {
            throw new ValidationException("amount", "must be > 0, got " + amount);
        }
        if (amount > getRemainingBudget()) {
            throw new InsufficientSecuredFundsException("released + forfeited + refunded <= committed",
                "contract " + id, amount, getRemainingBudget());
        }
    }

    private void requireStatus(String operation, ContractStatus... allowed) {
        for (ContractStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new InvalidStateException("contract", id, status.name(), operation);
    }

    private void transitionTo(ContractStatus next) {
        this.status = next;
        this.updatedAt = Instant.now();
    }
}
