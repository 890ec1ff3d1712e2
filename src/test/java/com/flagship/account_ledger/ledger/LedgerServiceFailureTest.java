package com.flagship.account_ledger.ledger;

import com.flagship.account_ledger.config.JacksonConfig;
import com.flagship.account_ledger.config.LedgerProperties;
import com.flagship.account_ledger.ledger.exception.ErrorKind;
import com.flagship.account_ledger.ledger.exception.SnapshotDecodeException;
import com.flagship.account_ledger.ledger.exception.SnapshotIOException;
import com.flagship.account_ledger.observability.LedgerMetrics;
import com.flagship.account_ledger.snapshot.CorruptSnapshotPolicy;
import com.flagship.account_ledger.snapshot.JsonFileSnapshotStore;
import com.flagship.account_ledger.snapshot.LedgerState;
import com.flagship.account_ledger.snapshot.SnapshotStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Failure scenarios: the ledger keeps its invariants when persistence breaks
 * or a transfer leg fails after the source was debited.
 */
class LedgerServiceFailureTest {

    private SimpleMeterRegistry registry;
    private LedgerProperties properties;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new LedgerProperties();
    }

    private LedgerService newLedger(SnapshotStore store) {
        return new LedgerService(store, properties, new LedgerMetrics(registry));
    }

    @Nested
    @DisplayName("Corrupt snapshot at start-up")
    class CorruptSnapshot {

        @TempDir
        Path tempDir;

        private JsonFileSnapshotStore corruptStore() throws IOException {
            Path file = tempDir.resolve("accounts.json");
            Files.writeString(file, "{ \"accounts\": { \"ACC-000001\": ", StandardCharsets.UTF_8);
            return new JsonFileSnapshotStore(file, JacksonConfig.createObjectMapper(), true);
        }

        @Test
        @DisplayName("EMPTY policy falls back to an empty ledger")
        void testEmptyPolicy() throws IOException {
            LedgerService ledger = newLedger(corruptStore());

            assertTrue(ledger.getAccounts().isEmpty());
            assertEquals("ACC-000001", ledger.createAccount("Alice").getAccountId());
        }

        @Test
        @DisplayName("FAIL policy refuses to start")
        void testFailPolicy() throws IOException {
            properties.getSnapshot().setOnCorrupt(CorruptSnapshotPolicy.FAIL);
            JsonFileSnapshotStore store = corruptStore();

            SnapshotDecodeException e = assertThrows(SnapshotDecodeException.class, () -> newLedger(store));
            assertEquals(ErrorKind.PERSISTENCE_DECODE_FAILURE, e.getKind());
        }

        @Test
        @DisplayName("Unreadable storage is not treated as corruption")
        void testIoFailureOnLoad() {
            SnapshotStore store = mock(SnapshotStore.class);
            when(store.load()).thenThrow(new SnapshotIOException("permission denied", new IOException("EACCES")));

            SnapshotIOException e = assertThrows(SnapshotIOException.class, () -> newLedger(store));
            assertEquals(ErrorKind.PERSISTENCE_IO_FAILURE, e.getKind());
        }
    }

    @Nested
    @DisplayName("Snapshot write failures")
    class WriteFailure {

        private SnapshotStore store;

        @BeforeEach
        void setUpStore() {
            store = mock(SnapshotStore.class);
            when(store.load()).thenReturn(LedgerState.empty());
        }

        @Test
        @DisplayName("Write failure is reported to the caller as PERSISTENCE_IO_FAILURE")
        void testWriteFailure() {
            LedgerService ledger = newLedger(store);
            Account account = ledger.createAccount("Alice", new BigDecimal("100"));

            doThrow(new SnapshotIOException("disk full", new IOException("ENOSPC")))
                .when(store).save(any());

            SnapshotIOException e = assertThrows(SnapshotIOException.class,
                () -> ledger.deposit(account.getAccountId(), new BigDecimal("50"), null));

            assertEquals(ErrorKind.PERSISTENCE_IO_FAILURE, e.getKind());
            assertEquals(1.0, registry.counter("ledger.snapshot.writes", "result", "failure").count());
            assertEquals(1.0, registry.counter("ledger.operations.rejected", "kind", "persistence_io_failure").count());
            // The in-memory mutation stays applied; the next successful write catches up.
            assertEquals(0, account.getBalance().compareTo(new BigDecimal("150")));
        }

        @Test
        @DisplayName("Every mutating operation writes exactly one snapshot")
        void testWriteThroughCount() {
            LedgerService ledger = newLedger(store);
            Account a = ledger.createAccount("Alice", new BigDecimal("100"));
            Account b = ledger.createAccount("Bob");
            ledger.deposit(a.getAccountId(), new BigDecimal("1"), null);
            ledger.withdraw(a.getAccountId(), new BigDecimal("1"), null);
            ledger.transfer(a.getAccountId(), b.getAccountId(), new BigDecimal("10"));
            ledger.deactivateAccount(b.getAccountId());
            ledger.activateAccount(b.getAccountId());

            verify(store, times(7)).save(any());
        }

        @Test
        @DisplayName("Rejected operations write nothing")
        void testRejectedOperationsDoNotWrite() {
            LedgerService ledger = newLedger(store);
            Account a = ledger.createAccount("Alice", new BigDecimal("100"));

            assertThrows(RuntimeException.class, () -> ledger.withdraw(a.getAccountId(), new BigDecimal("1000"), null));
            assertThrows(RuntimeException.class, () -> ledger.deposit(a.getAccountId(), BigDecimal.ZERO, null));
            assertThrows(RuntimeException.class, () -> ledger.getAccount("nope"));

            verify(store, times(1)).save(any());
        }
    }

    @Nested
    @DisplayName("Transfer deposit leg failure")
    class Compensation {

        @Test
        @DisplayName("Source is credited back when the deposit leg fails after the withdrawal")
        void testCompensatingCredit() {
            Instant now = Instant.now();
            Account source = Account.restore("ACC-000001", "Alice", BigDecimal.ZERO, true, List.of(), now, 0);
            source.deposit(new BigDecimal("1000"), "Initial deposit");
            Account destination = spy(Account.restore("ACC-000002", "Bob", BigDecimal.ZERO, true, List.of(), now, 0));
            doThrow(new IllegalStateException("destination ledger unavailable"))
                .when(destination).deposit(any(), anyString());

            SnapshotStore store = mock(SnapshotStore.class);
            when(store.load()).thenReturn(new LedgerState(List.of(source, destination), 2));
            LedgerService ledger = newLedger(store);

            IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ledger.transfer("ACC-000001", "ACC-000002", new BigDecimal("200")));

            assertEquals("destination ledger unavailable", e.getMessage());
            assertEquals(0, source.getBalance().compareTo(new BigDecimal("1000")));
            assertEquals(0, destination.getBalance().signum());

            List<Transaction> log = source.getTransactions();
            assertEquals(3, log.size());
            assertEquals(TransactionType.WITHDRAWAL, log.get(1).getType());
            assertEquals(TransactionType.DEPOSIT, log.get(2).getType());
            assertEquals("Reversal of ACC-000001-TXN-0002", log.get(2).getDescription());
            assertEquals(1.0, registry.counter("ledger.transfers", "result", "compensated").count());
            verify(store, times(1)).save(any());
        }
    }

    @Nested
    @DisplayName("Transfer logging context")
    class TransferContext {

        @Test
        @DisplayName("Both account IDs are in the MDC while a transfer runs, and cleared afterwards")
        void testTransferPairInMdc() {
            Instant now = Instant.now();
            Account source = Account.restore("ACC-000001", "Alice", BigDecimal.ZERO, true, List.of(), now, 0);
            source.deposit(new BigDecimal("100"), "Initial deposit");
            Account destination = spy(Account.restore("ACC-000002", "Bob", BigDecimal.ZERO, true, List.of(), now, 0));
            AtomicReference<String> seen = new AtomicReference<>();
            doAnswer(invocation -> {
                seen.set(MDC.get("accountId"));
                return invocation.callRealMethod();
            }).when(destination).deposit(any(), anyString());

            SnapshotStore store = mock(SnapshotStore.class);
            when(store.load()).thenReturn(new LedgerState(List.of(source, destination), 2));
            LedgerService ledger = newLedger(store);

            ledger.transfer("ACC-000001", "ACC-000002", new BigDecimal("40"));

            assertEquals("ACC-000001->ACC-000002", seen.get());
            assertNull(MDC.get("accountId"));
            assertEquals(0, destination.getBalance().compareTo(new BigDecimal("40")));
        }
    }
}
