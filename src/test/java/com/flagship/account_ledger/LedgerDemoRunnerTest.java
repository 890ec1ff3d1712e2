package com.flagship.account_ledger;

import com.flagship.account_ledger.config.JacksonConfig;
import com.flagship.account_ledger.config.LedgerProperties;
import com.flagship.account_ledger.ledger.LedgerService;
import com.flagship.account_ledger.observability.LedgerMetrics;
import com.flagship.account_ledger.snapshot.JsonFileSnapshotStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LedgerDemoRunnerTest {

    @TempDir
    Path tempDir;

    private JsonFileSnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new JsonFileSnapshotStore(tempDir.resolve("accounts.json"), JacksonConfig.createObjectMapper(), true);
    }

    private LedgerService newLedger() {
        return new LedgerService(store, new LedgerProperties(), new LedgerMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("Walkthrough on an empty ledger leaves Alice at 950 and Bob at 700")
    void testWalkthrough() {
        LedgerService ledger = newLedger();

        new LedgerDemoRunner(ledger).run();

        assertEquals(2, ledger.getAccounts().size());
        assertEquals(0, ledger.getAccount("ACC-000001").getBalance().compareTo(new BigDecimal("950.00")));
        assertEquals(0, ledger.getAccount("ACC-000002").getBalance().compareTo(new BigDecimal("700.00")));
        assertEquals(0, ledger.getTotalBalance().compareTo(new BigDecimal("1650.00")));
    }

    @Test
    @DisplayName("Walkthrough leaves a restored ledger untouched")
    void testExistingLedgerUntouched() {
        new LedgerDemoRunner(newLedger()).run();

        LedgerService restarted = newLedger();
        new LedgerDemoRunner(restarted).run();

        assertEquals(2, restarted.getAccounts().size());
        assertEquals(4, restarted.getAccount("ACC-000001").getTransactions().size());
    }
}
