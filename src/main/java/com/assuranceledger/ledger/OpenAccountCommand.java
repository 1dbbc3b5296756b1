package com.assuranceledger.ledger;

import com.assuranceledger.subjects.SubjectRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to open a secured balance account, optionally scoped to one contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenAccountCommand {

    private String tenantId;

    /**
     * Contract the account secures. A contract has at most one account.
     */
    private String contractId;

    private AccountType accountType;

    private String customTypeCode;

    /**
     * Defaults to the contract currency when the account is scoped to a contract.
     */
    private String currency;

    private SubjectRef ownerSubject;

    private SubjectRef counterpartySubject;
}
