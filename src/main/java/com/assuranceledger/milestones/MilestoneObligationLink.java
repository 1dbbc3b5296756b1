package com.assuranceledger.milestones;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Weighted membership of an obligation in a milestone. Both ends belong to {@link #contractId}.
 */
@Entity
@Table(name = "milestone_obligation_links",
    uniqueConstraints = @UniqueConstraint(name = "uk_milestone_obligation",
        columnNames = {"tenant_id", "milestone_id", "obligation_id"}),
    indexes = @Index(name = "idx_link_obligation", columnList = "tenant_id, obligation_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MilestoneObligationLink {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private String contractId;

    @Column(name = "milestone_id", nullable = false, updatable = false)
    private String milestoneId;

    @Column(name = "obligation_id", nullable = false, updatable = false)
    private String obligationId;

    @Column(nullable = false, updatable = false)
    private long weight;

    /**
     * Non-required links are advisory for all/any gating but still count toward thresholds.
     */
    @Column(nullable = false, updatable = false)
    private boolean required;

    private int sortOrder;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public MilestoneObligationLink(String tenantId, String contractId, String milestoneId, String obligationId,
                                   long weight, boolean required, int sortOrder) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.contractId = contractId;
        this.milestoneId = milestoneId;
        this.obligationId = obligationId;
        this.weight = weight;
        this.required = required;
        this.sortOrder = sortOrder;
        this.createdAt = Instant.now();
    }
}
