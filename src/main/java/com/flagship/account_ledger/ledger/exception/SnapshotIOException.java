package com.flagship.account_ledger.ledger.exception;

/**
 * Raised when the snapshot cannot be read or written at the storage layer.
 */
public class SnapshotIOException extends LedgerException {

    public SnapshotIOException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE_IO_FAILURE, message, cause);
    }
}
