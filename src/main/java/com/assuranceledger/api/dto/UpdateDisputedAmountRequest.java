package com.assuranceledger.api.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class UpdateDisputedAmountRequest {

    @PositiveOrZero(message = "Disputed amount must not be negative")
    private BigDecimal disputedAmount;
}
