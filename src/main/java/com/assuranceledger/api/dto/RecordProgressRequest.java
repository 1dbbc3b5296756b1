package com.assuranceledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class RecordProgressRequest {

    @NotNull(message = "Increment is required")
    @Positive(message = "Increment must be positive")
    private BigDecimal increment;
}
