package com.flagship.account_ledger.ledger.exception;

import com.flagship.account_ledger.ledger.Money;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Raised when an amount fails validation for the operation it was given to.
 */
@Getter
public class InvalidAmountException extends LedgerException {

    private final BigDecimal amount;
    private final String operation;

    private InvalidAmountException(BigDecimal amount, String operation, String message) {
        super(ErrorKind.INVALID_AMOUNT, message);
        this.amount = amount;
        this.operation = operation;
    }

    public static InvalidAmountException mustBePositive(BigDecimal amount, String operation) {
        return new InvalidAmountException(amount, operation,
            String.format("Invalid %s: amount must be positive (%s)", operation, Money.format(amount)));
    }

    public static InvalidAmountException mustNotBeNegative(BigDecimal amount, String operation) {
        return new InvalidAmountException(amount, operation,
            String.format("Invalid %s: amount cannot be negative (%s)", operation, Money.format(amount)));
    }
}
