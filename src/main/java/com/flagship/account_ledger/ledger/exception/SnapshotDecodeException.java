package com.flagship.account_ledger.ledger.exception;

/**
 * Raised when snapshot content is unreadable as a ledger state: malformed JSON,
 * missing required fields, or data that breaks an account invariant.
 */
public class SnapshotDecodeException extends LedgerException {

    public SnapshotDecodeException(String message) {
        super(ErrorKind.PERSISTENCE_DECODE_FAILURE, message);
    }

    public SnapshotDecodeException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE_DECODE_FAILURE, message, cause);
    }
}
