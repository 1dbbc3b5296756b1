package com.assuranceledger.claims;

import com.assuranceledger.subjects.SubjectRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request to open a claim against a contract, optionally about one milestone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenClaimCommand {

    private String tenantId;

    private String contractId;

    private String milestoneId;

    private ClaimType claimType;

    private String customTypeCode;

    private String title;

    private SubjectRef raisedBy;

    private SubjectRef against;

    private Long disputedAmount;

    private Instant respondByAt;

    private String actor;

    private String note;
}
