package com.assuranceledger.milestones;

import com.assuranceledger.common.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Release gate aggregating one or more obligations of a contract.
 *
 * The release amount is fixed when the milestone is created and is never recomputed from
 * obligation amounts.
 */
@Entity
@Table(name = "commitment_milestones",
    uniqueConstraints = @UniqueConstraint(name = "uk_milestone_code", columnNames = {"tenant_id", "contract_id", "code"}),
    indexes = @Index(name = "idx_milestone_contract_status", columnList = "tenant_id, contract_id, status"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Milestone {

    @Id
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private String tenantId;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private String contractId;

    @Column(nullable = false, length = 100, updatable = false)
    private String code;

    private String title;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MilestoneStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EvaluationMode evaluationMode;

    /**
     * Minimum satisfied weight or count; threshold mode only.
     */
    private Integer minSatisfiedCount;

    /**
     * Per-milestone override of the configured threshold counting convention.
     */
    @Enumerated(EnumType.STRING)
    private ThresholdCounting thresholdCounting;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReleaseMode releaseMode;

    private long releaseAmount;

    private Instant dueAt;

    private Instant readyAt;

    private Instant releasedAt;

    private String releasedBy;

    private Instant cancelledAt;

    private Instant skippedAt;

    private int sortOrder;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    public Milestone(String tenantId, String contractId, String code, String title, EvaluationMode evaluationMode,
                     Integer minSatisfiedCount, ThresholdCounting thresholdCounting, ReleaseMode releaseMode,
                     long releaseAmount, Instant dueAt, int sortOrder) {
        this.id = UUID.randomUUID().toString();
        this.tenantId = tenantId;
        this.contractId = contractId;
        this.code = code;
        this.title = title;
        this.evaluationMode = evaluationMode;
        this.minSatisfiedCount = minSatisfiedCount;
        this.thresholdCounting = thresholdCounting;
        this.releaseMode = releaseMode;
        this.releaseAmount = releaseAmount;
        this.dueAt = dueAt;
        this.sortOrder = sortOrder;
        this.status = MilestoneStatus.PENDING;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public void markReady() {
        requireStatus("mark ready", MilestoneStatus.PENDING);
        readyAt = Instant.now();
        transitionTo(MilestoneStatus.READY);
    }

    /**
     * Fall back from ready when a previously satisfied obligation no longer counts.
     */
    public void markPending() {
        requireStatus("mark pending", MilestoneStatus.READY);
        readyAt = null;
        transitionTo(MilestoneStatus.PENDING);
    }

    public void markReleased(String actor) {
        requireStatus("release", MilestoneStatus.READY);
        releasedAt = Instant.now();
        releasedBy = actor;
        transitionTo(MilestoneStatus.RELEASED);
    }

    public void cancel() {
        requireStatus("cancel", MilestoneStatus.PENDING, MilestoneStatus.READY);
        cancelledAt = Instant.now();
        transitionTo(MilestoneStatus.CANCELLED);
    }

    public void skip() {
        requireStatus("skip", MilestoneStatus.PENDING, MilestoneStatus.READY);
        skippedAt = Instant.now();
        transitionTo(MilestoneStatus.SKIPPED);
    }

    public boolean isReady() {
        return status == MilestoneStatus.READY;
    }

    public boolean isReleased() {
        return status == MilestoneStatus.RELEASED;
    }

    public boolean isAutomatic() {
        return releaseMode == ReleaseMode.AUTOMATIC;
    }

    private void requireStatus(String operation, MilestoneStatus... allowed) {
        for (MilestoneStatus candidate : allowed) {
            if (status == candidate) {
                return;
            }
        }
        throw new InvalidStateException("milestone", id, status.name(), operation);
    }

    private void transitionTo(MilestoneStatus next) {
        this.status = next;
        this.updatedAt = Instant.now();
    }
}
