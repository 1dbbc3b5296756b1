package com.assuranceledger.api.dto;

import com.assuranceledger.claims.ResolutionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class ResolveClaimRequest {

    @NotNull(message = "Resolution type is required")
    private ResolutionType resolutionType;

    @PositiveOrZero(message = "Settled amount must not be negative")
    private BigDecimal settledAmount;

    private String note;
}
