package com.flagship.account_ledger.snapshot;

import com.flagship.account_ledger.ledger.Account;
import lombok.Value;

import java.util.List;

/**
 * Full ledger state handed to and returned by a {@link SnapshotStore}.
 *
 * accountCounter is the sequence number of the last account ID issued,
 * so an empty ledger has 0 and mints ACC-000001 next.
 */
@Value
public class LedgerState {
    List<Account> accounts;
    long accountCounter;

    public LedgerState(List<Account> accounts, long accountCounter) {
        this.accounts = List.copyOf(accounts);
        this.accountCounter = accountCounter;
    }

    public static LedgerState empty() {
        return new LedgerState(List.of(), 0L);
    }
}
