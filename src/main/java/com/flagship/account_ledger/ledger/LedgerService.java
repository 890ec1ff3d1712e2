package com.flagship.account_ledger.ledger;

import com.flagship.account_ledger.config.LedgerProperties;
import com.flagship.account_ledger.ledger.exception.AccountNotFoundException;
import com.flagship.account_ledger.ledger.exception.LedgerException;
import com.flagship.account_ledger.ledger.exception.SnapshotDecodeException;
import com.flagship.account_ledger.ledger.exception.SnapshotIOException;
import com.flagship.account_ledger.observability.LedgerMetrics;
import com.flagship.account_ledger.snapshot.CorruptSnapshotPolicy;
import com.flagship.account_ledger.snapshot.LedgerState;
import com.flagship.account_ledger.snapshot.SnapshotStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The ledger: account registry, account-ID allocation, transfers and aggregates.
 *
 * This service enforces:
 * 1. Every key in the registry equals its account's ID
 * 2. Account IDs are minted from a monotonic counter and never reused
 * 3. Every successful mutation is written through to the snapshot store
 * 4. Transfers never leave the source debited without the destination credited
 *
 * All operations run under a single lock (single-writer model), so account
 * invariants hold without per-account locking and transfers cannot deadlock.
 * The snapshot write happens inside the same critical section.
 *
 * State is hydrated from the snapshot store on construction.
 */
@Service
@Slf4j
public class LedgerService {

    static final String ACCOUNT_ID_FORMAT = "ACC-%06d";
    static final String INITIAL_DEPOSIT_DESCRIPTION = "Initial deposit";

    private static final String ACCOUNT_ID_MDC_KEY = "accountId";
    private static final String TRANSFER_MDC_SEPARATOR = "->";

    private final SnapshotStore snapshotStore;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private long accountCounter;

    public LedgerService(SnapshotStore snapshotStore, LedgerProperties properties, LedgerMetrics metrics) {
        this.snapshotStore = snapshotStore;
        this.properties = properties;
        this.metrics = metrics;
        hydrate();
    }

    // ==================== Account Lifecycle ====================

    public Account createAccount(String owner) {
        return createAccount(owner, BigDecimal.ZERO);
    }

    /**
     * Opens a new account.
     *
     * A positive initial deposit goes through {@link Account#deposit}, so it is
     * recorded as the account's first transaction ({@code ...-TXN-0001}).
     *
     * @param owner Account owner's name
     * @param initialDeposit Opening balance, zero or positive
     * @return The newly created account
     * @throws IllegalArgumentException if owner is blank
     * @throws com.flagship.account_ledger.ledger.exception.InvalidAmountException if initialDeposit is negative
     */
    public Account createAccount(String owner, BigDecimal initialDeposit) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Account owner is required");
        }
        return execute("Account creation", null, () -> {
            log.info("Creating account for: {}", owner);
            Money.requireNonNegative(initialDeposit, "initial deposit");

            String accountId = String.format(ACCOUNT_ID_FORMAT, accountCounter + 1);
            Account account = Account.open(accountId, owner);
            if (initialDeposit.signum() > 0) {
                account.deposit(initialDeposit, INITIAL_DEPOSIT_DESCRIPTION);
            }

            accountCounter++;
            accounts.put(accountId, account);
            metrics.recordAccountCreated();
            if (initialDeposit.signum() > 0) {
                metrics.recordTransaction(TransactionType.DEPOSIT);
            }
            persist();

            log.info("Account created: id={}, owner={}, initialBalance={}",
                accountId, owner, Money.format(initialDeposit));
            return account;
        });
    }

    /**
     * Gets an account by ID.
     *
     * @throws AccountNotFoundException if no account has this ID
     */
    public Account getAccount(String accountId) {
        return execute("Account lookup", accountId, () -> requireAccount(accountId));
    }

    /**
     * Looks an account up without failing when it is absent.
     */
    public Optional<Account> findAccount(String accountId) {
        return read(() -> Optional.ofNullable(accounts.get(accountId)));
    }

    /**
     * All accounts in creation order.
     */
    public List<Account> getAccounts() {
        return read(() -> List.copyOf(accounts.values()));
    }

    public Account deactivateAccount(String accountId) {
        return execute("Account deactivation", accountId, () -> {
            Account account = requireAccount(accountId);
            account.deactivate();
            persist();
            log.info("Account deactivated: id={}", accountId);
            return account;
        });
    }

    public Account activateAccount(String accountId) {
        return execute("Account activation", accountId, () -> {
            Account account = requireAccount(accountId);
            account.activate();
            persist();
            log.info("Account activated: id={}", accountId);
            return account;
        });
    }

    // ==================== Money Movement ====================

    public Transaction deposit(String accountId, BigDecimal amount, String description) {
        return execute("Deposit", accountId, () -> {
            Transaction transaction = requireAccount(accountId).deposit(amount, description);
            metrics.recordTransaction(TransactionType.DEPOSIT);
            persist();
            log.info("Deposit successful: id={}, amount={}, newBalance={}",
                transaction.getId(), Money.format(amount), Money.format(transaction.getBalanceAfter()));
            return transaction;
        });
    }

    public Transaction withdraw(String accountId, BigDecimal amount, String description) {
        return execute("Withdrawal", accountId, () -> {
            Transaction transaction = requireAccount(accountId).withdraw(amount, description);
            metrics.recordTransaction(TransactionType.WITHDRAWAL);
            persist();
            log.info("Withdrawal successful: id={}, amount={}, newBalance={}",
                transaction.getId(), Money.format(amount), Money.format(transaction.getBalanceAfter()));
            return transaction;
        });
    }

    public TransferResult transfer(String fromId, String toId, BigDecimal amount) {
        return transfer(fromId, toId, amount, null);
    }

    /**
     * Moves funds between two accounts.
     *
     * Phase 1 validates both legs without touching either account: amount,
     * both accounts active, sufficient funds in the source. Any failure here
     * leaves both accounts unchanged.
     *
     * Phase 2 withdraws from the source, then deposits to the destination.
     * Should the deposit leg still fail, a compensating deposit restores the
     * source balance and the original error is rethrown.
     *
     * @return Both transactions, withdrawal first
     * @throws AccountNotFoundException if either account does not exist
     * @throws com.flagship.account_ledger.ledger.exception.InsufficientFundsException if the source balance is too low
     * @throws com.flagship.account_ledger.ledger.exception.InvalidAmountException if amount is not positive
     * @throws com.flagship.account_ledger.ledger.exception.InactiveAccountException if either account is inactive
     * @throws IllegalArgumentException if source and destination are the same account
     */
    public TransferResult transfer(String fromId, String toId, BigDecimal amount, String description) {
        return execute("Transfer", fromId + TRANSFER_MDC_SEPARATOR + toId, () -> {
            log.info("Transfer attempt: from={}, to={}, amount={}", fromId, toId, Money.format(amount));

            Account source = requireAccount(fromId);
            Account destination = requireAccount(toId);
            if (fromId.equals(toId)) {
                throw new IllegalArgumentException("Cannot transfer to the same account: " + fromId);
            }

            source.checkWithdrawal(amount);
            destination.checkDeposit(amount);

            String suffix = description != null ? ": " + description : "";
            Transaction withdrawal = source.withdraw(amount, "Transfer to " + toId + suffix);
            Transaction deposit;
            try {
                deposit = destination.deposit(amount, "Transfer from " + fromId + suffix);
            } catch (RuntimeException e) {
                compensate(source, withdrawal, e);
                throw e;
            }

            metrics.recordTransaction(TransactionType.WITHDRAWAL);
            metrics.recordTransaction(TransactionType.DEPOSIT);
            metrics.recordTransfer(LedgerMetrics.TRANSFER_SUCCESS);
            persist();

            log.info("Transfer successful: from={}, to={}, amount={}", fromId, toId, Money.format(amount));
            return new TransferResult(withdrawal, deposit);
        });
    }

    private void compensate(Account source, Transaction withdrawal, RuntimeException cause) {
        Transaction reversal = source.deposit(withdrawal.getAmount(), "Reversal of " + withdrawal.getId());
        log.error("Transfer deposit leg failed, source credited back: withdrawal={}, reversal={}, error={}",
            withdrawal.getId(), reversal.getId(), cause.getMessage());
        metrics.recordTransfer(LedgerMetrics.TRANSFER_COMPENSATED);
        try {
            persist();
        } catch (SnapshotIOException e) {
            cause.addSuppressed(e);
        }
    }

    // ==================== Queries ====================

    /**
     * Sum of balances over active accounts; inactive accounts are left out entirely.
     */
    public BigDecimal getTotalBalance() {
        return read(() -> accounts.values().stream()
            .filter(Account::isActive)
            .map(Account::getBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    public LedgerStats stats() {
        return read(() -> {
            int active = 0;
            long transactionCount = 0;
            BigDecimal activeBalance = BigDecimal.ZERO;
            BigDecimal inactiveBalance = BigDecimal.ZERO;

            for (Account account : accounts.values()) {
                transactionCount += account.getTransactions().size();
                if (account.isActive()) {
                    active++;
                    activeBalance = activeBalance.add(account.getBalance());
                } else {
                    inactiveBalance = inactiveBalance.add(account.getBalance());
                }
            }

            return LedgerStats.builder()
                .totalAccounts(accounts.size())
                .activeAccounts(active)
                .inactiveAccounts(accounts.size() - active)
                .transactionCount(transactionCount)
                .activeBalance(activeBalance)
                .inactiveBalance(inactiveBalance)
                .build();
        });
    }

    /**
     * Statement of one account, sized from {@code ledger.statement.size}.
     */
    public String statement(String accountId) {
        return execute("Statement", accountId,
            () -> requireAccount(accountId).statement(properties.getStatement().getSize()));
    }

    public String summary() {
        return read(() -> {
            List<String> lines = new ArrayList<>();
            lines.add("=".repeat(50));
            lines.add("ACCOUNT SUMMARY");
            lines.add("=".repeat(50));
            for (Account account : accounts.values()) {
                lines.add(String.format("%s: %s - %s%s", account.getAccountId(), account.getOwner(),
                    Money.format(account.getBalance()), account.isActive() ? "" : " (inactive)"));
            }
            lines.add("");
            lines.add("Total accounts: " + accounts.size());
            return String.join("\n", lines);
        });
    }

    // ==================== Persistence ====================

    /**
     * Discards in-memory state and rehydrates from the snapshot store.
     */
    public void reload() {
        execute("Reload", null, () -> {
            hydrate();
            return null;
        });
    }

    /**
     * Writes the current state. Called on shutdown as the final flush.
     */
    @PreDestroy
    public void flush() {
        execute("Flush", null, () -> {
            persist();
            return null;
        });
    }

    private void hydrate() {
        LedgerState state;
        try {
            state = snapshotStore.load();
        } catch (SnapshotDecodeException e) {
            if (properties.getSnapshot().getOnCorrupt() == CorruptSnapshotPolicy.FAIL) {
                log.error("Snapshot is corrupt and policy is FAIL: {}", e.getMessage());
                throw e;
            }
            log.warn("Snapshot is corrupt, starting with an empty ledger: {}", e.getMessage());
            state = LedgerState.empty();
        }

        accounts.clear();
        for (Account account : state.getAccounts()) {
            accounts.put(account.getAccountId(), account);
        }
        accountCounter = Math.max(state.getAccountCounter(), accounts.size());
        log.info("Ledger hydrated: accounts={}, accountCounter={}", accounts.size(), accountCounter);
    }

    private void persist() {
        long start = System.nanoTime();
        try {
            snapshotStore.save(new LedgerState(new ArrayList<>(accounts.values()), accountCounter));
            metrics.recordSnapshotWrite(true, Duration.ofNanos(System.nanoTime() - start));
        } catch (SnapshotIOException e) {
            metrics.recordSnapshotWrite(false, Duration.ofNanos(System.nanoTime() - start));
            throw e;
        }
    }

    // ==================== Helpers ====================

    private Account requireAccount(String accountId) {
        Account account = accounts.get(accountId);
        if (account == null) {
            throw new AccountNotFoundException(accountId);
        }
        return account;
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs an operation under the ledger lock with the account ID (for transfers
     * {@code from->to}) in the MDC.
     * Ledger failures are counted and logged once here, then rethrown unchanged.
     */
    private <T> T execute(String operation, String accountId, Supplier<T> action) {
        lock.lock();
        if (accountId != null) {
            MDC.put(ACCOUNT_ID_MDC_KEY, accountId);
        }
        try {
            return action.get();
        } catch (LedgerException e) {
            metrics.recordRejected(e.getKind());
            if (e.getKind().isPersistenceFailure()) {
                log.error("{} failed: {}", operation, e.getMessage());
            } else {
                log.warn("{} failed: {}", operation, e.getMessage());
            }
            throw e;
        } finally {
            MDC.remove(ACCOUNT_ID_MDC_KEY);
            lock.unlock();
        }
    }
}
