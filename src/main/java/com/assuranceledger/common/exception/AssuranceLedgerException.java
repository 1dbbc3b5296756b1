package com.assuranceledger.common.exception;

/**
 * Base exception for all assurance ledger exceptions.
 *
 * Each subclass names the precise check that failed so callers can explain a rejection
 * without re-deriving the ledger fold.
 */
public class AssuranceLedgerException extends RuntimeException {

    public AssuranceLedgerException(String message) {
        super(message);
    }

    public AssuranceLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
