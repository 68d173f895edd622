package com.opentrips.common.util;

import com.opentrips.common.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Limits of the money columns, stored as DECIMAL(12, 2).
 */
public final class MoneyAmounts {
    private MoneyAmounts() {
        // Utility class
    }

    public static final int INTEGER_DIGITS = 10;
    public static final int FRACTION_DIGITS = 2;

    /**
     * Rejects amounts the money columns cannot store exactly: more than two decimals
     * or more than ten integer digits. Null is accepted.
     *
     * @param field  Name used in the error message
     * @param amount Amount to check
     * @throws ValidationException when the amount does not fit
     */
    public static void requireStorable(String field, BigDecimal amount) {
        if (amount == null) {
            return;
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        int fractionDigits = Math.max(normalized.scale(), 0);
        int integerDigits = normalized.precision() - normalized.scale();
        if (fractionDigits > FRACTION_DIGITS) {
            throw new ValidationException(String.format(
                    "%s %s has more than %d decimal places", field, amount.toPlainString(), FRACTION_DIGITS));
        }
        if (integerDigits > INTEGER_DIGITS) {
            throw new ValidationException(String.format(
                    "%s %s has more than %d integer digits", field, amount.toPlainString(), INTEGER_DIGITS));
        }
    }
}
