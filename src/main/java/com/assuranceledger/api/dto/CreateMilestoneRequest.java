package com.assuranceledger.api.dto;

import com.assuranceledger.milestones.EvaluationMode;
import com.assuranceledger.milestones.ReleaseMode;
import com.assuranceledger.milestones.ThresholdCounting;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * DTO for defining a milestone. {@code minSatisfiedCount} and {@code thresholdCounting} apply
 * to threshold milestones only.
 */
@Data
public class CreateMilestoneRequest {

    @NotBlank(message = "Contract ID is required")
    private String contractId;

    @NotBlank(message = "Milestone code is required")
    private String code;

    private String title;

    @NotNull(message = "Evaluation mode is required")
    private EvaluationMode evaluationMode;

    private Integer minSatisfiedCount;

    private ThresholdCounting thresholdCounting;

    private ReleaseMode releaseMode = ReleaseMode.MANUAL;

    @NotNull(message = "Release amount is required")
    @PositiveOrZero(message = "Release amount must not be negative")
    private BigDecimal releaseAmount;

    private Instant dueAt;

    private int sortOrder;
}
