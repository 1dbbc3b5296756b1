package com.assuranceledger.common.exception;

/**
 * Thrown when an operation would break a monetary invariant,
 * e.g. {@code released + forfeited > committed} or {@code held > balance}.
 */
public class InvariantViolationException extends AssuranceLedgerException {

    private final String invariant;

    public InvariantViolationException(String invariant, String message) {
        super(String.format("Invariant '%s' violated: %s", invariant, message));
        this.invariant = invariant;
    }

    public String getInvariant() {
        return invariant;
    }
}
