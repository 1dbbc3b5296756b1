package com.assuranceledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ReverseFundingRequest {

    @NotBlank(message = "Funding entry ID is required")
    private String fundingEntryId;

    @NotBlank(message = "Idempotency key is required")
    private String idempotencyKey;

    private String reasonCode;

    private String notes;
}
