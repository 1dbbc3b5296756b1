package com.assuranceledger.contracts;

import com.assuranceledger.subjects.SubjectRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request to create a commitment contract in {@link ContractStatus#DRAFT}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateContractCommand {

    private String tenantId;

    private ContractType contractType;

    private String customTypeCode;

    private String title;

    private SubjectRef anchorSubject;

    private SubjectRef counterpartySubject;

    private String currency;

    /**
     * Committed amount in minor units.
     */
    private long committedAmount;

    private Instant startedAt;

    private Instant expiresAt;

    /**
     * Falls back to {@code assurance-ledger.contracts.default-cancellation-policy}.
     */
    private CancellationPolicy cancellationPolicy;

    /**
     * Falls back to {@code assurance-ledger.claims.default-freeze-policy}.
     */
    private ClaimFreezePolicy claimFreezePolicy;
}
