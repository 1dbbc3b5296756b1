package com.assuranceledger.api.dto;

import com.assuranceledger.contracts.CancellationPolicy;
import com.assuranceledger.contracts.ClaimFreezePolicy;
import com.assuranceledger.contracts.ContractType;
import com.assuranceledger.subjects.SubjectRef;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * DTO for creating a commitment contract. Amounts are in minor units.
 */
@Data
public class CreateContractRequest {

    @NotNull(message = "Contract type is required")
    private ContractType contractType;

    private String customTypeCode;

    private String title;

    @NotNull(message = "Anchor subject is required")
    private SubjectRef anchorSubject;

    private SubjectRef counterpartySubject;

    @NotBlank(message = "Currency is required")
    private String currency;

    @NotNull(message = "Committed amount is required")
    @PositiveOrZero(message = "Committed amount must not be negative")
    private BigDecimal committedAmount;

    private Instant startedAt;

    private Instant expiresAt;

    private CancellationPolicy cancellationPolicy;

    private ClaimFreezePolicy claimFreezePolicy;
}
