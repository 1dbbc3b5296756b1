package com.assuranceledger.claims;

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
 * Dispute raised against a commitment contract.
 *
 * The row is a current-state snapshot; its history lives in {@link ClaimEvent}.
 */
@Entity
@Table(name = "commitment_claims", indexes = {
    @Index(name = "idx_claim_contract_status", columnList = "tenant_id, contract_id, status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Claim {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private String contractId;

    /**
     * Disputed milestone, if the claim is about one milestone only.
     */
    @Column(updatable = false)
    private String milestoneId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ClaimType claimType;

    private String customTypeCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ClaimStatus status;

    @Enumerated(EnumType.STRING)
    private ResolutionType resolutionType;

    private String title;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "raised_by_subject_kind", nullable = false)),
        @AttributeOverride(name = "id", column = @Column(name = "raised_by_subject_id", nullable = false))
    })
    private SubjectRef raisedBy;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "against_subject_kind")),
        @AttributeOverride(name = "id", column = @Column(name = "against_subject_id"))
    })
    private SubjectRef against;

    private Long disputedAmount;

    private Long settledAmount;

    private String settlementEntryId;

    private Instant openedAt;

    private Instant respondByAt;

    private Instant resolvedAt;

    private String resolvedBy;

    private Instant closedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public Claim(String tenantId, String contractId, String milestoneId, ClaimType claimType, String customTypeCode,
                 String title, SubjectRef raisedBy, SubjectRef against, Long disputedAmount, Instant respondByAt) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.contractId = contractId;
        this.milestoneId = milestoneId;
        this.claimType = claimType;
        this.customTypeCode = customTypeCode;
        this.title = title;
        this.raisedBy = raisedBy;
        this.against = against;
        this.disputedAmount = disputedAmount;
        this.respondByAt = respondByAt;
        this.status = ClaimStatus.OPEN;
        this.openedAt = Instant.now();
        this.updatedAt = this.openedAt;
    }

    public void startReview() {
        requireStatus("start review", ClaimStatus.OPEN);
        transitionTo(ClaimStatus.IN_REVIEW);
    }

    public void escalate() {
        requireStatus("escalate", ClaimStatus.OPEN, ClaimStatus.IN_REVIEW);
        transitionTo(ClaimStatus.ESCALATED);
    }

    public void resolve(ResolutionType resolution, Long settled, String actor) {
        requireUnresolved("resolve");
        if (resolution == null) {
            throw new ValidationException("resolutionType", "is required to resolve a claim");
        }
        if (settled != null) {
            if (settled < 0) {
                throw new ValidationException("settledAmount", "must be >= 0, got " + settled);
            }
            if (disputedAmount != null && settled > disputedAmount) {
                throw new ValidationException("settledAmount",
                    String.format("%d exceeds disputed amount %d", settled, disputedAmount));
            }
        }
        this.resolutionType = resolution;
        this.settledAmount = settled;
        this.resolvedAt = Instant.now();
        this.resolvedBy = actor;
        transitionTo(ClaimStatus.RESOLVED);
    }

    public void close() {
        requireStatus("close", ClaimStatus.RESOLVED);
        if (resolvedAt == null || resolutionType == null) {
            throw new InvalidStateException("claim", id, status.name(), "close", "claim was never resolved");
        }
        closedAt = Instant.now();
        transitionTo(ClaimStatus.CLOSED);
    }

    public void reject() {
        requireUnresolved("reject");
        closedAt = Instant.now();
        transitionTo(ClaimStatus.REJECTED);
    }

    public void cancel() {
        requireUnresolved("cancel");
        closedAt = Instant.now();
        transitionTo(ClaimStatus.CANCELLED);
    }

    /**
     * Link the compensating ledger entry posted for this claim's resolution.
     */
    public void attachSettlement(String ledgerEntryId) {
        if (status != ClaimStatus.RESOLVED || settlementEntryId != null) {
            throw new InvalidStateException("claim", id, status.name(), "attach settlement");
        }
        this.settlementEntryId = ledgerEntryId;
    }

    public void updateDisputedAmount(Long amount) {
        requireUnresolved("update disputed amount");
        if (amount != null && amount < 0) {
            throw new ValidationException("disputedAmount", "must be >= 0, got " + amount);
        }
        this.disputedAmount = amount;
        this.updatedAt = Instant.now();
    }

    public boolean isPending() {
        return status.isPending();
    }

    private void requireUnresolved(String operation) {
        if (!status.isUnresolved()) {
            throw new InvalidStateException("claim", id, status.name(), operation);
        }
    }

    private void requireStatus(String operation, ClaimStatus... allowed) {
        for (ClaimStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new InvalidStateException("claim", id, status.name(), operation);
    }

    private void transitionTo(ClaimStatus next) {
        this.status = next;
        this.updatedAt = Instant.now();
    }
}
