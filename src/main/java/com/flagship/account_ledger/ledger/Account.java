package com.flagship.account_ledger.ledger;

import com.flagship.account_ledger.ledger.exception.InactiveAccountException;
import com.flagship.account_ledger.ledger.exception.InsufficientFundsException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An account with a balance and an append-only transaction log.
 *
 * Key invariants:
 * - balance always equals the balanceAfter of the most recent transaction (0 if none)
 * - balance never goes negative
 * - transactionCounter only grows, and only when a transaction is actually recorded
 *
 * Every mutation validates first and touches state last, so a rejected
 * deposit or withdrawal leaves the account exactly as it was.
 *
 * Mutators are package-private: accounts handed out by {@link LedgerService}
 * change only through its operations, which hold the ledger lock and write
 * the snapshot.
 */
@Slf4j
@Getter
public class Account {

    public static final int DEFAULT_STATEMENT_SIZE = 10;

    private static final String TRANSACTION_ID_FORMAT = "%s-TXN-%04d";
    private static final DateTimeFormatter STATEMENT_TIME_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneId.systemDefault());

    private final String accountId;
    private final String owner;
    private final Instant createdAt;
    private BigDecimal balance;
    private boolean active;
    private long transactionCounter;

    @Getter(AccessLevel.NONE)
    private final List<Transaction> transactions;

    Account(String accountId, String owner, Instant createdAt) {
        this(accountId, owner, createdAt, BigDecimal.ZERO, true, new ArrayList<>(), 0L);
    }

    private Account(String accountId, String owner, Instant createdAt, BigDecimal balance,
                    boolean active, List<Transaction> transactions, long transactionCounter) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.balance = balance;
        this.active = active;
        this.transactions = transactions;
        this.transactionCounter = transactionCounter;
    }

    /**
     * Opens a new, empty, active account.
     */
    public static Account open(String accountId, String owner) {
        return new Account(accountId, owner, Instant.now());
    }

    /**
     * Rebuilds an account from persisted state.
     *
     * @throws IllegalArgumentException if the state breaks an account invariant
     */
    public static Account restore(String accountId, String owner, BigDecimal balance, boolean active,
                                  List<Transaction> transactions, Instant createdAt, long transactionCounter) {
        Objects.requireNonNull(balance, "balance");
        if (balance.signum() < 0) {
            throw new IllegalArgumentException(
                String.format("Account %s has a negative balance: %s", accountId, balance));
        }
        if (transactionCounter < 0) {
            throw new IllegalArgumentException(
                String.format("Account %s has a negative transaction counter: %d", accountId, transactionCounter));
        }
        List<Transaction> log = new ArrayList<>(transactions);
        BigDecimal expected = log.isEmpty() ? BigDecimal.ZERO : log.get(log.size() - 1).getBalanceAfter();
        if (balance.compareTo(expected) != 0) {
            throw new IllegalArgumentException(String.format(
                "Account %s balance %s does not match its last transaction balance %s",
                accountId, balance, expected));
        }
        return new Account(accountId, owner, createdAt, balance, active, log, transactionCounter);
    }

    /**
     * Deposits money into the account.
     *
     * @param amount Amount to deposit (must be positive)
     * @param description Optional transaction description
     * @return The recorded transaction
     * @throws InactiveAccountException if the account is inactive
     * @throws com.flagship.account_ledger.ledger.exception.InvalidAmountException if amount is not positive
     */
    Transaction deposit(BigDecimal amount, String description) {
        log.debug("Deposit attempt: account={}, amount={}", accountId, amount);
        checkDeposit(amount);
        return record(TransactionType.DEPOSIT, amount, balance.add(amount), description);
    }

    /**
     * Withdraws money from the account.
     *
     * @param amount Amount to withdraw (must be positive and not exceed the balance)
     * @param description Optional transaction description
     * @return The recorded transaction
     * @throws InactiveAccountException if the account is inactive
     * @throws com.flagship.account_ledger.ledger.exception.InvalidAmountException if amount is not positive
     * @throws InsufficientFundsException if amount exceeds the balance
     */
    Transaction withdraw(BigDecimal amount, String description) {
        log.debug("Withdrawal attempt: account={}, amount={}, balance={}", accountId, amount, balance);
        checkWithdrawal(amount);
        return record(TransactionType.WITHDRAWAL, amount, balance.subtract(amount), description);
    }

    /**
     * Runs every deposit check without changing anything.
     */
    public void checkDeposit(BigDecimal amount) {
        requireActive();
        Money.requirePositive(amount, TransactionType.DEPOSIT.getOperation());
    }

    /**
     * Runs every withdrawal check without changing anything.
     */
    public void checkWithdrawal(BigDecimal amount) {
        requireActive();
        Money.requirePositive(amount, TransactionType.WITHDRAWAL.getOperation());
        if (amount.compareTo(balance) > 0) {
            throw new InsufficientFundsException(accountId, balance, amount);
        }
    }

    private Transaction record(TransactionType type, BigDecimal amount, BigDecimal newBalance, String description) {
        long sequence = transactionCounter + 1;
        Transaction transaction = Transaction.create(
            String.format(TRANSACTION_ID_FORMAT, accountId, sequence), type, amount, newBalance, description);

        transactionCounter = sequence;
        balance = newBalance;
        transactions.add(transaction);

        log.debug("Recorded {}: id={}, amount={}, balance={}",
            type.getOperation(), transaction.getId(), amount, newBalance);
        return transaction;
    }

    private void requireActive() {
        if (!active) {
            throw new InactiveAccountException(accountId);
        }
    }

    void deactivate() {
        this.active = false;
    }

    void activate() {
        this.active = true;
    }

    /**
     * Read-only view of the transaction log, oldest first.
     */
    public List<Transaction> getTransactions() {
        return Collections.unmodifiableList(transactions);
    }

    /**
     * Copy of the transaction log, oldest first.
     */
    public List<Transaction> getTransactionHistory() {
        return List.copyOf(transactions);
    }

    public Optional<Transaction> getLastTransaction() {
        return transactions.isEmpty()
            ? Optional.empty()
            : Optional.of(transactions.get(transactions.size() - 1));
    }

    public String statement() {
        return statement(DEFAULT_STATEMENT_SIZE);
    }

    /**
     * Formats the most recent transactions for display.
     *
     * @param limit Maximum number of transactions to include, most recent last
     */
    public String statement(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Statement size cannot be negative: " + limit);
        }
        List<String> lines = new ArrayList<>();
        lines.add("Account Statement: " + accountId);
        lines.add("Owner: " + owner);
        lines.add("Current Balance: " + Money.format(balance));
        lines.add("Status: " + (active ? "Active" : "Inactive"));
        lines.add("-".repeat(60));
        lines.add("Transactions:");

        List<Transaction> recent = transactions.subList(Math.max(0, transactions.size() - limit), transactions.size());
        if (recent.isEmpty()) {
            lines.add("  (no transactions)");
        }
        for (Transaction txn : recent) {
            String line = String.format("  %s | %-10s | $%10s | Balance: $%10s",
                STATEMENT_TIME_FORMAT.format(txn.getTimestamp()),
                txn.getType().name(),
                Money.plain(txn.getAmount()),
                Money.plain(txn.getBalanceAfter()));
            if (txn.getDescription() != null) {
                line += " | " + txn.getDescription();
            }
            lines.add(line);
        }
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return String.format("Account(%s, owner=%s, balance=%s, %s, transactions=%d)",
            accountId, owner, Money.format(balance), active ? "active" : "inactive", transactions.size());
    }
}
