package com.assuranceledger.common.exception;

/**
 * Thrown when the held balance or the remaining committed budget cannot cover a release,
 * forfeit or refund.
 */
public class InsufficientSecuredFundsException extends InvariantViolationException {

    private final long requiredMinor;
    private final long availableMinor;

    public InsufficientSecuredFundsException(String invariant, String subjectId, long requiredMinor, long availableMinor) {
        super(invariant, String.format("Insufficient secured funds for %s. Required: %d, Available: %d",
            subjectId, requiredMinor, availableMinor));
        this.requiredMinor = requiredMinor;
        this.availableMinor = availableMinor;
    }

    public long getRequiredMinor() {
        return requiredMinor;
    }

    public long getAvailableMinor() {
        return availableMinor;
    }
}
