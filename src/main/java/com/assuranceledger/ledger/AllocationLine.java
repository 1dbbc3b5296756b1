package com.assuranceledger.ledger;

import com.assuranceledger.common.exception.ValidationException;
import com.assuranceledger.subjects.SubjectRef;
import lombok.Builder;
import lombok.Value;

/**
 * Requested allocation of part of a posting to a target.
 */
@Value
@Builder
public class AllocationLine {

    AllocationType allocationType;
    long amount;
    String obligationId;
    String milestoneId;
    String externalLineId;
    SubjectRef targetSubject;

    public static AllocationLine toMilestone(AllocationType type, String milestoneId, long amount) {
        return AllocationLine.builder()
            .allocationType(type)
            .milestoneId(milestoneId)
            .amount(amount)
            .build();
    }

    void validate() {
        if (allocationType == null) {
            throw new ValidationException("allocationType", "is required");
        }
        if (amount <= 0) {
            throw new ValidationException("allocatedAmount", "must be > 0, got " + amount);
        }
        if (obligationId == null && milestoneId == null && externalLineId == null && targetSubject == null) {
            throw new ValidationException("allocation", "needs at least one target");
        }
    }
}
