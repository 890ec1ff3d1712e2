package com.flagship.account_ledger.ledger.exception;

import lombok.Getter;

@Getter
public class InactiveAccountException extends LedgerException {

    private final String accountId;

    public InactiveAccountException(String accountId) {
        super(ErrorKind.INACTIVE_ACCOUNT, "Account is inactive: " + accountId);
        this.accountId = accountId;
    }
}
