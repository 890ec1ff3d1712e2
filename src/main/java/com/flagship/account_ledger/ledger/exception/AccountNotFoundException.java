package com.flagship.account_ledger.ledger.exception;

import lombok.Getter;

@Getter
public class AccountNotFoundException extends LedgerException {

    private final String accountId;

    public AccountNotFoundException(String accountId) {
        super(ErrorKind.ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
        this.accountId = accountId;
    }
}
