package com.assuranceledger.obligations;

import com.assuranceledger.common.exception.InvalidStateException;
import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.subjects.SubjectRef;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One condition that must be satisfied under a commitment contract.
 *
 * Obligations are never deleted; they are retired through a terminal status.
 */
@Entity
@Table(name = "commitment_obligations", indexes = {
    @Index(name = "idx_obligation_contract", columnList = "tenant_id, contract_id"),
    @Index(name = "idx_obligation_status_due", columnList = "status, due_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Obligation {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private String contractId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ObligationType obligationType;

    private String customTypeCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ObligationStatus status;

    private String title;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "obligor_subject_kind")),
        @AttributeOverride(name = "id", column = @Column(name = "obligor_subject_id"))
    })
    private SubjectRef obligor;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "beneficiary_subject_kind")),
        @AttributeOverride(name = "id", column = @Column(name = "beneficiary_subject_id"))
    })
    private SubjectRef beneficiary;

    /**
     * Amount that must be reached before the obligation can be satisfied. Optional.
     */
    private Long requiredAmount;

    private long satisfiedAmount;

    @Column(name = "due_at")
    private Instant dueAt;

    private Instant satisfiedAt;
    private Instant breachedAt;
    private Instant waivedAt;
    private Instant cancelledAt;
    private Instant expiredAt;

    private int sortOrder;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public Obligation(String tenantId, String contractId, ObligationType obligationType, String customTypeCode,
                      String title, SubjectRef obligor, SubjectRef beneficiary, Long requiredAmount,
                      Instant dueAt, int sortOrder) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.contractId = contractId;
        this.obligationType = obligationType;
        this.customTypeCode = customTypeCode;
        this.title = title;
        this.obligor = obligor;
        this.beneficiary = beneficiary;
        this.requiredAmount = requiredAmount;
        this.satisfiedAmount = 0;
        this.dueAt = dueAt;
        this.sortOrder = sortOrder;
        this.status = ObligationStatus.PENDING;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public void start() {
        requireOpen("start");
        if (status == ObligationStatus.PENDING) {
            transitionTo(ObligationStatus.IN_PROGRESS);
        }
    }

    /**
     * Add a partial amount. Reaching {@link #requiredAmount} satisfies the obligation,
     * anything short of it keeps it in progress.
     */
    public void recordProgress(long increment) {
        requireOpen("record progress");
        if (requiredAmount == null) {
            throw new InvalidStateException("obligation", id, status.name(), "record progress",
                "obligation has no required amount");
        }
        if (increment <= 0) {
            throw new ValidationException("satisfiedAmount", "increment must be > 0, got " + increment);
        }
        long next = satisfiedAmount + increment;
        if (next > requiredAmount) {
            throw new ValidationException("satisfiedAmount",
                String.format("%d would exceed required amount %d", next, requiredAmount));
        }
        satisfiedAmount = next;
        if (next == requiredAmount) {
            satisfiedAt = Instant.now();
            transitionTo(ObligationStatus.SATISFIED);
        } else {
            transitionTo(ObligationStatus.IN_PROGRESS);
        }
    }

    public void satisfy() {
        requireOpen("satisfy");
        if (requiredAmount != null && satisfiedAmount != requiredAmount) {
            throw new InvalidStateException("obligation", id, status.name(), "satisfy",
                String.format("satisfied amount %d does not equal required amount %d", satisfiedAmount, requiredAmount));
        }
        satisfiedAt = Instant.now();
        transitionTo(ObligationStatus.SATISFIED);
    }

    /**
     * @return {@code false} if the obligation was already breached
     */
    public boolean breach() {
        if (status == ObligationStatus.BREACHED) {
            return false;
        }
        requireOpen("breach");
        breachedAt = Instant.now();
        transitionTo(ObligationStatus.BREACHED);
        return true;
    }

    public void waive() {
        requireOpen("waive");
        waivedAt = Instant.now();
        transitionTo(ObligationStatus.WAIVED);
    }

    public void cancel() {
        requireOpen("cancel");
        cancelledAt = Instant.now();
        transitionTo(ObligationStatus.CANCELLED);
    }

    /**
     * @return {@code false} if the obligation was already expired
     */
    public boolean expire() {
        if (status == ObligationStatus.EXPIRED) {
            return false;
        }
        requireOpen("expire");
        expiredAt = Instant.now();
        transitionTo(ObligationStatus.EXPIRED);
        return true;
    }

    /**
     * Move a satisfied or waived obligation back to in progress. Dependent milestones are
     * re-evaluated and may fall back from ready to pending.
     */
    public void reopen() {
        if (status != ObligationStatus.SATISFIED && status != ObligationStatus.WAIVED) {
            throw new InvalidStateException("obligation", id, status.name(), "reopen");
        }
        satisfiedAt = null;
        waivedAt = null;
        transitionTo(ObligationStatus.IN_PROGRESS);
    }

    public boolean isSatisfied() {
        return status == ObligationStatus.SATISFIED;
    }

    private void requireOpen(String operation) {
        if (!status.isOpen()) {
            throw new InvalidStateException("obligation", id, status.name(), operation);
        }
    }

    private void transitionTo(ObligationStatus next) {
        this.status = next;
        this.updatedAt = Instant.now();
    }
}
