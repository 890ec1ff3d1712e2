package com.flagship.account_ledger.snapshot;

/**
 * Durable storage for the full ledger state.
 *
 * Implementations overwrite the whole document on every save; there is no
 * incremental write or write-ahead log.
 */
public interface SnapshotStore {

    /**
     * Writes the state, fully replacing whatever was stored before.
     *
     * @throws com.flagship.account_ledger.ledger.exception.SnapshotIOException if the state cannot be written
     */
    void save(LedgerState state);

    /**
     * Reads the stored state.
     *
     * @return The stored state, or {@link LedgerState#empty()} if nothing has been stored yet
     * @throws com.flagship.account_ledger.ledger.exception.SnapshotDecodeException if the stored content is invalid
     * @throws com.flagship.account_ledger.ledger.exception.SnapshotIOException if the storage cannot be read
     */
    LedgerState load();

    boolean exists();

    /**
     * Removes the stored state, if any.
     */
    void clear();
}
