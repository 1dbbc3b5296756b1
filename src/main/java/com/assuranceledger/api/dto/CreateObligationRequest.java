package com.assuranceledger.api.dto;

import com.assuranceledger.obligations.ObligationType;
import com.assuranceledger.subjects.SubjectRef;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * DTO for adding an obligation to a contract.
 */
@Data
public class CreateObligationRequest {

    @NotBlank(message = "Contract ID is required")
    private String contractId;

    @NotNull(message = "Obligation type is required")
    private ObligationType obligationType;

    private String customTypeCode;

    private String title;

    private SubjectRef obligor;

    private SubjectRef beneficiary;

    @Positive(message = "Required amount must be positive")
    private BigDecimal requiredAmount;

    private Instant dueAt;

    private int sortOrder;
}
