package com.flagship.account_ledger.ledger.exception;

/**
 * Kinds of failure a ledger operation can report.
 *
 * Callers branch on the kind rather than on the concrete exception type.
 */
public enum ErrorKind {
    /**
     * Non-positive (or negative, for opening balances) amount supplied to a mutating operation.
     */
    INVALID_AMOUNT,

    /**
     * Withdrawal or transfer exceeds the available balance.
     */
    INSUFFICIENT_FUNDS,

    /**
     * Mutation attempted on a deactivated account.
     */
    INACTIVE_ACCOUNT,

    /**
     * Lookup by an unknown account ID.
     */
    ACCOUNT_NOT_FOUND,

    /**
     * Snapshot content could not be decoded into a valid ledger state.
     */
    PERSISTENCE_DECODE_FAILURE,

    /**
     * Snapshot could not be read or written at the storage layer.
     */
    PERSISTENCE_IO_FAILURE;

    public boolean isPersistenceFailure() {
        return this == PERSISTENCE_DECODE_FAILURE || this == PERSISTENCE_IO_FAILURE;
    }
}
