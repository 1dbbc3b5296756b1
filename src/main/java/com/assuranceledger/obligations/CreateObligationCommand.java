package com.assuranceledger.obligations;

import com.assuranceledger.subjects.SubjectRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request to add an obligation to a non-terminal contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateObligationCommand {

    private String tenantId;

    private String contractId;

    private ObligationType obligationType;

    private String customTypeCode;

    private String title;

    private SubjectRef obligor;

    private SubjectRef beneficiary;

    /**
     * Amount to reach before the obligation can be satisfied, in minor units. Optional.
     */
    private Long requiredAmount;

    private Instant dueAt;

    private int sortOrder;
}
