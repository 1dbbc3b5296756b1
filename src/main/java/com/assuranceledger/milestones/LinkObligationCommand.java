package com.assuranceledger.milestones;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to link an obligation to a milestone of the same contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkObligationCommand {

    private String tenantId;

    private String milestoneId;

    private String obligationId;

    @Builder.Default
    private long weight = 1;

    @Builder.Default
    private boolean required = true;

    private int sortOrder;
}
