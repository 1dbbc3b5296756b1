package com.assuranceledger.api.dto;

import com.assuranceledger.claims.ClaimType;
import com.assuranceledger.subjects.SubjectRef;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * DTO for opening a claim against a contract, optionally scoped to one milestone.
 */
@Data
public class OpenClaimRequest {

    @NotBlank(message = "Contract ID is required")
    private String contractId;

    private String milestoneId;

    @NotNull(message = "Claim type is required")
    private ClaimType claimType;

    private String customTypeCode;

    private String title;

    @NotNull(message = "Raising subject is required")
    private SubjectRef raisedBy;

    private SubjectRef against;

    @PositiveOrZero(message = "Disputed amount must not be negative")
    private BigDecimal disputedAmount;

    private Instant respondByAt;

    private String note;
}
