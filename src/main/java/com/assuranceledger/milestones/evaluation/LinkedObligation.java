package com.assuranceledger.milestones.evaluation;

import com.assuranceledger.obligations.ObligationStatus;
import lombok.Value;

/**
 * A milestone link joined with the current status of its obligation.
 */
@Value
public class LinkedObligation {
    String obligationId;
    long weight;
    boolean required;
    ObligationStatus status;

    /**
     * Only satisfied obligations count; breached, waived and expired ones never do.
     */
    public boolean isSatisfied() {
        return status == ObligationStatus.SATISFIED;
    }
}
