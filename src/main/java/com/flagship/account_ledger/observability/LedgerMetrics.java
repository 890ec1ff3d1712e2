package com.flagship.account_ledger.observability;

import com.flagship.account_ledger.ledger.TransactionType;
import com.flagship.account_ledger.ledger.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.accounts.created: Counter of opened accounts
 * - ledger.transactions: Counter of recorded transactions, tagged by type
 * - ledger.transfers: Counter of transfers, tagged by result
 * - ledger.operations.rejected: Counter of failed operations, tagged by error kind
 * - ledger.snapshot.writes: Counter of snapshot writes, tagged by result
 * - ledger.snapshot.write.duration: Timer for snapshot writes
 */
@Component
public class LedgerMetrics {

    public static final String TRANSFER_SUCCESS = "success";
    public static final String TRANSFER_COMPENSATED = "compensated";

    private final MeterRegistry registry;

    private final Counter accountsCreated;
    private final Timer snapshotWriteTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.accountsCreated = Counter.builder("ledger.accounts.created")
                .description("Number of accounts opened")
                .register(registry);

        this.snapshotWriteTimer = Timer.builder("ledger.snapshot.write.duration")
                .description("Time taken to write the ledger snapshot")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordAccountCreated() {
        accountsCreated.increment();
    }

    public void recordTransaction(TransactionType type) {
        registry.counter("ledger.transactions",
                "type", type.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    public void recordTransfer(String result) {
        registry.counter("ledger.transfers", "result", result).increment();
    }

    public void recordRejected(ErrorKind kind) {
        registry.counter("ledger.operations.rejected",
                "kind", kind.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    /**
     * Records one snapshot write attempt and how long it took.
     */
    public void recordSnapshotWrite(boolean success, Duration duration) {
        registry.counter("ledger.snapshot.writes", "result", success ? "success" : "failure").increment();
        snapshotWriteTimer.record(duration);
    }
}
