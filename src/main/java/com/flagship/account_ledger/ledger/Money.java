package com.flagship.account_ledger.ledger;

import com.flagship.account_ledger.ledger.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Amount validation and display formatting.
 *
 * Amounts are compared with {@link BigDecimal#compareTo}, never {@code equals},
 * so 100 and 100.00 are the same amount. Stored values keep full precision;
 * rounding to two fractional digits happens only for display.
 */
public final class Money {

    public static final int DISPLAY_SCALE = 2;

    private Money() {
        // Utility class
    }

    /**
     * Validates that an amount is strictly positive.
     *
     * @param amount Amount to check
     * @param operation Operation name used in the error message (e.g. "deposit")
     * @return The same amount, for fluent use
     * @throws InvalidAmountException if amount is null, zero or negative
     */
    public static BigDecimal requirePositive(BigDecimal amount, String operation) {
        if (amount == null || amount.signum() <= 0) {
            throw InvalidAmountException.mustBePositive(amount, operation);
        }
        return amount;
    }

    /**
     * Validates that an amount is zero or positive.
     *
     * @throws InvalidAmountException if amount is null or negative
     */
    public static BigDecimal requireNonNegative(BigDecimal amount, String operation) {
        if (amount == null || amount.signum() < 0) {
            throw InvalidAmountException.mustNotBeNegative(amount, operation);
        }
        return amount;
    }

    /**
     * Renders an amount with two fractional digits, without currency sign.
     */
    public static String plain(BigDecimal amount) {
        if (amount == null) {
            return "null";
        }
        return amount.setScale(DISPLAY_SCALE, RoundingMode.HALF_EVEN).toPlainString();
    }

    /**
     * Renders an amount for user-facing text, e.g. {@code $1234.50}.
     */
    public static String format(BigDecimal amount) {
        return amount == null ? "null" : "$" + plain(amount);
    }
}
