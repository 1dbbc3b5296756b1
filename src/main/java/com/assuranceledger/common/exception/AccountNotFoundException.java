package com.assuranceledger.common.exception;

/**
 * Thrown when a secured balance account is not found.
 */
public class AccountNotFoundException extends NotFoundException {

    public AccountNotFoundException(String accountId) {
        super("Secured balance account", accountId);
    }

    public static AccountNotFoundException forContract(String contractId) {
        return new AccountNotFoundException("for contract " + contractId);
    }
}
