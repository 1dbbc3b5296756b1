package com.assuranceledger.api.dto;

import com.assuranceledger.contracts.CancellationPolicy;
import com.assuranceledger.contracts.ClaimFreezePolicy;
import lombok.Data;

@Data
public class UpdatePoliciesRequest {

    private CancellationPolicy cancellationPolicy;

    private ClaimFreezePolicy claimFreezePolicy;
}
