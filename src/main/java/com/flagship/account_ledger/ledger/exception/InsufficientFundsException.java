package com.flagship.account_ledger.ledger.exception;

import com.flagship.account_ledger.ledger.Money;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Raised when a withdrawal exceeds the available balance.
 */
@Getter
public class InsufficientFundsException extends LedgerException {

    private final String accountId;
    private final BigDecimal balance;
    private final BigDecimal amount;
    private final BigDecimal shortfall;

    public InsufficientFundsException(String accountId, BigDecimal balance, BigDecimal amount) {
        super(ErrorKind.INSUFFICIENT_FUNDS, String.format(
            "Insufficient funds in %s: balance %s, attempted %s, short %s",
            accountId, Money.format(balance), Money.format(amount), Money.format(amount.subtract(balance))));
        this.accountId = accountId;
        this.balance = balance;
        this.amount = amount;
        this.shortfall = amount.subtract(balance);
    }
}
