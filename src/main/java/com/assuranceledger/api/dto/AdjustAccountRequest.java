package com.assuranceledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for an operator correction. Deltas are signed minor units; omitted deltas are zero.
 */
@Data
public class AdjustAccountRequest {

    private BigDecimal balanceDelta;

    private BigDecimal heldDelta;

    private String correctsEntryId;

    @NotBlank(message = "Idempotency key is required")
    private String idempotencyKey;

    @NotBlank(message = "Reason code is required")
    private String reasonCode;

    private String externalReference;

    private String notes;
}
