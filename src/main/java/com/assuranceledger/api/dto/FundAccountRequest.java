package com.assuranceledger.api.dto;

import com.assuranceledger.subjects.SubjectRef;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO recording money received from the external funding source.
 */
@Data
public class FundAccountRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigDecimal amount;

    private String currency;

    @NotBlank(message = "Idempotency key is required")
    private String idempotencyKey;

    private String externalTransactionId;

    private SubjectRef sourceSubject;

    private String notes;
}
