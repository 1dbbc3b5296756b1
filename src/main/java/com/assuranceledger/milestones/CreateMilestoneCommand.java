package com.assuranceledger.milestones;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request to add a milestone to a non-terminal contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateMilestoneCommand {

    private String tenantId;

    private String contractId;

    /**
     * Unique within the contract.
     */
    private String code;

    private String title;

    private EvaluationMode evaluationMode;

    private Integer minSatisfiedCount;

    private ThresholdCounting thresholdCounting;

    @Builder.Default
    private ReleaseMode releaseMode = ReleaseMode.MANUAL;

    /**
     * Fixed release amount in minor units; may be zero for gates that move no money.
     */
    private long releaseAmount;

    private Instant dueAt;

    private int sortOrder;
}
