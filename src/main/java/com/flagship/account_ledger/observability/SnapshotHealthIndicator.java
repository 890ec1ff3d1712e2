package com.flagship.account_ledger.observability;

import com.flagship.account_ledger.config.LedgerProperties;
import com.flagship.account_ledger.ledger.LedgerService;
import com.flagship.account_ledger.ledger.LedgerStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health indicator for snapshot persistence.
 * Down if the snapshot file cannot be written, since every mutation writes through.
 * A missing directory is fine as long as its nearest existing ancestor is writable,
 * because the store creates it on first save.
 */
@Component("snapshotHealth")
public class SnapshotHealthIndicator implements HealthIndicator {

    private final LedgerProperties properties;
    private final LedgerService ledgerService;

    public SnapshotHealthIndicator(LedgerProperties properties, LedgerService ledgerService) {
        this.properties = properties;
        this.ledgerService = ledgerService;
    }

    @Override
    public Health health() {
        Path path = Path.of(properties.getSnapshot().getPath()).toAbsolutePath();
        try {
            boolean writable = Files.exists(path)
                    ? Files.isWritable(path)
                    : isCreatable(path.getParent());

            LedgerStats stats = ledgerService.stats();
            Health.Builder builder = writable ? Health.up() : Health.down();

            return builder
                    .withDetail("path", path.toString())
                    .withDetail("writable", writable)
                    .withDetail("accounts", stats.getTotalAccounts())
                    .withDetail("transactions", stats.getTransactionCount())
                    .build();

        } catch (Exception e) {
            return Health.down()
                    .withDetail("path", path.toString())
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }

    private static boolean isCreatable(Path directory) {
        Path existing = directory;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        return existing != null && Files.isDirectory(existing) && Files.isWritable(existing);
    }
}
