package com.assuranceledger.common.exception;

/**
 * Thrown on lock or version contention. Safe to retry.
 */
public class ConcurrencyConflictException extends AssuranceLedgerException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
