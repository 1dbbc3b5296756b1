package com.assuranceledger.common;

import com.assuranceledger.common.exception.ValidationException;

import java.util.UUID;

/**
 * Utility class for generating, composing and validating idempotency keys.
 * Keys are unique per tenant; a replayed key returns the prior outcome instead of posting twice.
 */
public final class IdempotencyKey {

    public static final int MAX_LENGTH = 200;

    private IdempotencyKey() {
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }

    /**
     * Deterministic key for an operation on a contract, e.g. {@code (contractId, milestoneId, "release")}.
     */
    public static String of(String contractId, String targetId, String operation) {
        return validate(contractId + ":" + targetId + ":" + operation);
    }

    public static boolean isValid(String key) {
        return key != null && !key.isBlank() && key.length() <= MAX_LENGTH;
    }

    public static String validate(String key) {
        if (!isValid(key)) {
            throw new ValidationException("idempotencyKey",
                "must be non-blank and at most " + MAX_LENGTH + " characters");
        }
        return key;
    }
}
