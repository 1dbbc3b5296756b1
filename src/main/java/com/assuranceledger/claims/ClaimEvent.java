package com.assuranceledger.claims;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable timeline entry of a claim.
 */
@Entity
@Table(name = "commitment_claim_events",
    indexes = @Index(name = "idx_claim_event_claim", columnList = "tenant_id, claim_id, occurred_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ClaimEvent {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "claim_id", nullable = false, updatable = false)
    private String claimId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ClaimEventType eventType;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(updatable = false)
    private String actor;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private ClaimStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private ClaimStatus toStatus;

    /**
     * Ledger entry produced by this step, e.g. a settlement posting.
     */
    @Column(updatable = false)
    private String ledgerEntryId;

    @Column(length = 4000, updatable = false)
    private String note;

    ClaimEvent(Claim claim, ClaimEventType eventType, String actor, ClaimStatus fromStatus, String ledgerEntryId,
               String note) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = claim.getTenantId();
        this.claimId = claim.getId();
        this.eventType = eventType;
        this.occurredAt = Instant.now();
        this.actor = actor;
        this.fromStatus = fromStatus;
        this.toStatus = claim.getStatus();
        this.ledgerEntryId = ledgerEntryId;
        this.note = note;
    }
}
