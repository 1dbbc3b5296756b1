package com.assuranceledger.api.dto;

import com.assuranceledger.ledger.AccountType;
import com.assuranceledger.subjects.SubjectRef;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for opening a secured balance account. The currency defaults to the contract's.
 */
@Data
public class OpenAccountRequest {

    private String contractId;

    @NotNull(message = "Account type is required")
    private AccountType accountType;

    private String customTypeCode;

    private String currency;

    @NotNull(message = "Owner subject is required")
    private SubjectRef ownerSubject;

    private SubjectRef counterpartySubject;
}
