package com.assuranceledger.common.exception;

/**
 * Thrown for malformed input (negative amount, bad subject pair, unknown subject).
 * Raised before anything is persisted.
 */
public class ValidationException extends AssuranceLedgerException {

    private final String field;

    public ValidationException(String field, String message) {
        super(String.format("Invalid %s: %s", field, message));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
