package com.flagship.account_ledger.snapshot;

import com.flagship.account_ledger.ledger.Account;
import com.flagship.account_ledger.ledger.Transaction;
import com.flagship.account_ledger.ledger.TransactionType;
import com.flagship.account_ledger.ledger.exception.InvalidAmountException;
import com.flagship.account_ledger.ledger.exception.SnapshotDecodeException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between the live ledger state and its persisted document form.
 *
 * Decoding is strict about invariants and lenient about omissions:
 * - a missing _transaction_counter defaults to the log length
 * - a missing _account_counter defaults to the number of accounts
 * - a missing is_active defaults to true
 * - the account counter is raised to cover the highest ACC-nnnnnn ID present
 * - each transaction counter is raised to cover the highest {accountId}-TXN-nnnn ID in its log
 */
public final class SnapshotMapper {

    private static final Pattern ACCOUNT_SEQUENCE = Pattern.compile("^ACC-(\\d+)$");

    private SnapshotMapper() {
        // Utility class
    }

    public static LedgerSnapshot toSnapshot(LedgerState state) {
        LinkedHashMap<String, AccountSnapshot> accounts = new LinkedHashMap<>();
        for (Account account : state.getAccounts()) {
            accounts.put(account.getAccountId(), toSnapshot(account));
        }
        return new LedgerSnapshot(accounts, state.getAccountCounter());
    }

    static AccountSnapshot toSnapshot(Account account) {
        List<TransactionSnapshot> transactions = account.getTransactions().stream()
            .map(SnapshotMapper::toSnapshot)
            .toList();
        return new AccountSnapshot(
            account.getAccountId(),
            account.getOwner(),
            account.getBalance(),
            account.isActive(),
            transactions,
            account.getCreatedAt(),
            account.getTransactionCounter()
        );
    }

    static TransactionSnapshot toSnapshot(Transaction transaction) {
        return new TransactionSnapshot(
            transaction.getId(),
            transaction.getType().name(),
            transaction.getAmount(),
            transaction.getBalanceAfter(),
            transaction.getTimestamp(),
            transaction.getDescription()
        );
    }

    /**
     * Rebuilds the ledger state from a decoded document.
     *
     * @throws SnapshotDecodeException if a required field is missing or an account invariant is broken
     */
    public static LedgerState toState(LedgerSnapshot snapshot) {
        if (snapshot == null) {
            throw new SnapshotDecodeException("Snapshot document is empty");
        }
        List<Account> accounts = new ArrayList<>();
        long highestSequence = 0;

        for (Map.Entry<String, AccountSnapshot> entry : snapshot.accountsOrEmpty().entrySet()) {
            Account account = toAccount(entry.getKey(), entry.getValue());
            accounts.add(account);
            highestSequence = Math.max(highestSequence, accountSequence(account.getAccountId()));
        }

        long counter = snapshot.getAccountCounter() != null ? snapshot.getAccountCounter() : accounts.size();
        if (counter < 0) {
            throw new SnapshotDecodeException("Account counter cannot be negative: " + counter);
        }
        return new LedgerState(accounts, Math.max(counter, highestSequence));
    }

    private static Account toAccount(String key, AccountSnapshot data) {
        if (data == null) {
            throw new SnapshotDecodeException("Account entry " + key + " is null");
        }
        if (!key.equals(data.getAccountId())) {
            throw new SnapshotDecodeException(String.format(
                "Account key %s does not match account_id %s", key, data.getAccountId()));
        }
        require(data.getOwner(), "owner", key);
        require(data.getBalance(), "balance", key);
        require(data.getCreatedAt(), "created_at", key);

        List<Transaction> transactions = new ArrayList<>();
        if (data.getTransactions() != null) {
            for (TransactionSnapshot txn : data.getTransactions()) {
                transactions.add(toTransaction(key, txn));
            }
        }

        long counter = data.getTransactionCounter() != null ? data.getTransactionCounter() : transactions.size();
        if (counter < 0) {
            throw new SnapshotDecodeException(String.format(
                "Account %s has a negative transaction counter: %d", key, counter));
        }
        counter = Math.max(counter, highestTransactionSequence(key, transactions));
        boolean active = data.getIsActive() == null || data.getIsActive();

        try {
            return Account.restore(key, data.getOwner(), data.getBalance(), active,
                transactions, data.getCreatedAt(), counter);
        } catch (IllegalArgumentException e) {
            throw new SnapshotDecodeException(e.getMessage(), e);
        }
    }

    private static Transaction toTransaction(String accountId, TransactionSnapshot data) {
        if (data == null) {
            throw new SnapshotDecodeException("Null transaction in account " + accountId);
        }
        require(data.getId(), "id", accountId);
        require(data.getType(), "type", accountId);
        require(data.getAmount(), "amount", accountId);
        require(data.getBalanceAfter(), "balance_after", accountId);
        require(data.getTimestamp(), "timestamp", accountId);

        TransactionType type;
        try {
            type = TransactionType.valueOf(data.getType());
        } catch (IllegalArgumentException e) {
            throw new SnapshotDecodeException(String.format(
                "Unknown transaction type %s in %s", data.getType(), data.getId()), e);
        }

        try {
            return new Transaction(data.getId(), type, data.getAmount(), data.getBalanceAfter(),
                data.getTimestamp(), data.getDescription());
        } catch (InvalidAmountException e) {
            throw new SnapshotDecodeException(String.format(
                "Transaction %s has an invalid amount: %s", data.getId(), e.getMessage()), e);
        }
    }

    private static void require(Object value, String field, String accountId) {
        if (value == null) {
            throw new SnapshotDecodeException(String.format(
                "Missing required field '%s' in account %s", field, accountId));
        }
    }

    private static long highestTransactionSequence(String accountId, List<Transaction> transactions) {
        Pattern idPattern = Pattern.compile("^" + Pattern.quote(accountId) + "-TXN-(\\d+)$");
        long highest = 0;
        for (Transaction transaction : transactions) {
            Matcher matcher = idPattern.matcher(transaction.getId());
            if (matcher.matches()) {
                try {
                    highest = Math.max(highest, Long.parseLong(matcher.group(1)));
                } catch (NumberFormatException e) {
                    throw new SnapshotDecodeException("Transaction ID sequence out of range: " + transaction.getId(), e);
                }
            }
        }
        return highest;
    }

    private static long accountSequence(String accountId) {
        Matcher matcher = ACCOUNT_SEQUENCE.matcher(accountId);
        if (!matcher.matches()) {
            return 0;
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new SnapshotDecodeException("Account ID sequence out of range: " + accountId, e);
        }
    }
}
