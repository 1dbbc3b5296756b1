package com.assuranceledger.common;

import com.assuranceledger.common.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Currency;

/**
 * Immutable monetary amount in integer minor units (e.g. cents) with an ISO-4217 currency.
 *
 * Nothing here rounds: an amount that is not a whole number of minor units is rejected.
 */
@Value
public class Money {

    long amountMinor;
    String currency;

    public static Money of(long amountMinor, String currency) {
        return new Money(amountMinor, requireCurrency(currency));
    }

    /**
     * Build money from an externally supplied minor-unit value that may carry a fractional part.
     */
    public static Money ofMinor(BigDecimal amountMinor, String currency) {
        return of(requireWholeMinorUnits(amountMinor, "amount"), currency);
    }

    public static Money zero(String currency) {
        return of(0L, currency);
    }

    public Money add(Money other) {
        validateSameCurrency(other);
        return new Money(Math.addExact(this.amountMinor, other.amountMinor), this.currency);
    }

    public Money subtract(Money other) {
        validateSameCurrency(other);
        return new Money(Math.subtractExact(this.amountMinor, other.amountMinor), this.currency);
    }

    public boolean isGreaterThan(Money other) {
        validateSameCurrency(other);
        return this.amountMinor > other.amountMinor;
    }

    public boolean isPositive() {
        return amountMinor > 0;
    }

    public boolean isNegative() {
        return amountMinor < 0;
    }

    @Override
    public String toString() {
        return amountMinor + " " + currency;
    }

    public static long requireWholeMinorUnits(BigDecimal value, String field) {
        if (value == null) {
            throw new ValidationException(field, "amount is required");
        }
        try {
            return value.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException(field, "must be an integer number of minor units, got " + value.toPlainString());
        }
    }

    public static long requireNonNegative(long value, String field) {
        if (value < 0) {
            throw new ValidationException(field, "must be >= 0, got " + value);
        }
        return value;
    }

    public static long requirePositive(long value, String field) {
        if (value <= 0) {
            throw new ValidationException(field, "must be > 0, got " + value);
        }
        return value;
    }

    public static String requireCurrency(String currency) {
        if (currency == null || !currency.matches("^[A-Z]{3}$")) {
            throw new ValidationException("currency", "must be an uppercase ISO-4217 code, got " + currency);
        }
        try {
            Currency.getInstance(currency);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("currency", "unknown ISO-4217 code " + currency);
        }
        return currency;
    }

    private void validateSameCurrency(Money other) {
        if (!this.currency.equals(other.currency)) {
            throw new ValidationException("currency",
                String.format("Cannot perform operation on different currencies: %s and %s",
                    this.currency, other.currency));
        }
    }
}
