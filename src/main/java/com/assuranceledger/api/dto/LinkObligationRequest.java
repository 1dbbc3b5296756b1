package com.assuranceledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class LinkObligationRequest {

    @NotBlank(message = "Obligation ID is required")
    private String obligationId;

    @Positive(message = "Weight must be positive")
    private long weight = 1;

    private boolean required = true;

    private int sortOrder;
}
