package com.assuranceledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ClaimEvidenceRequest {

    @NotBlank(message = "Evidence reference is required")
    private String evidenceRef;

    private String note;
}
