package com.flagship.account_ledger.ledger.exception;

import lombok.Getter;

/**
 * Base type for every failure reported by the ledger.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final ErrorKind kind;

    protected LedgerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
