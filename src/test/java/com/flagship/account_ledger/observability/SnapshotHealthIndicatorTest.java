package com.flagship.account_ledger.observability;

import com.flagship.account_ledger.config.JacksonConfig;
import com.flagship.account_ledger.config.LedgerProperties;
import com.flagship.account_ledger.ledger.LedgerService;
import com.flagship.account_ledger.snapshot.JsonFileSnapshotStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SnapshotHealthIndicatorTest {

    @TempDir
    Path tempDir;

    private LedgerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
    }

    private LedgerService ledgerAt(Path file) {
        properties.getSnapshot().setPath(file.toString());
        JsonFileSnapshotStore store = new JsonFileSnapshotStore(file, JacksonConfig.createObjectMapper(), true);
        return new LedgerService(store, properties, new LedgerMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("UP with counts when the snapshot location is writable")
    void testUp() {
        LedgerService ledger = ledgerAt(tempDir.resolve("accounts.json"));
        ledger.createAccount("Alice", new BigDecimal("10"));
        ledger.createAccount("Bob");

        Health health = new SnapshotHealthIndicator(properties, ledger).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(true, health.getDetails().get("writable"));
        assertEquals(2, health.getDetails().get("accounts"));
        assertEquals(1L, health.getDetails().get("transactions"));
    }

    @Test
    @DisplayName("UP when the snapshot directory is missing but can be created")
    void testMissingDirectory() {
        LedgerService ledger = ledgerAt(tempDir.resolve("accounts.json"));
        properties.getSnapshot().setPath(tempDir.resolve("missing").resolve("nested").resolve("accounts.json").toString());

        Health health = new SnapshotHealthIndicator(properties, ledger).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(true, health.getDetails().get("writable"));
    }

    @Test
    @DisplayName("DOWN when a regular file blocks the snapshot directory")
    void testBlockedDirectory() throws IOException {
        LedgerService ledger = ledgerAt(tempDir.resolve("accounts.json"));
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        properties.getSnapshot().setPath(blocker.resolve("sub").resolve("accounts.json").toString());

        Health health = new SnapshotHealthIndicator(properties, ledger).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(false, health.getDetails().get("writable"));
    }

    @Test
    @DisplayName("DOWN with the error when the ledger cannot report")
    void testLedgerFailure() {
        properties.getSnapshot().setPath(tempDir.resolve("accounts.json").toString());
        LedgerService ledger = mock(LedgerService.class);
        when(ledger.stats()).thenThrow(new IllegalStateException("lock poisoned"));

        Health health = new SnapshotHealthIndicator(properties, ledger).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("lock poisoned", health.getDetails().get("error"));
    }
}
