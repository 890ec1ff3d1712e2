package com.flagship.account_ledger.snapshot;

/**
 * What the ledger does when the stored snapshot cannot be decoded at start-up.
 */
public enum CorruptSnapshotPolicy {
    /**
     * Log a warning and start with an empty ledger.
     */
    EMPTY,

    /**
     * Propagate the decode failure and refuse to start.
     */
    FAIL
}
