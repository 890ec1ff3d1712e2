package com.flagship.account_ledger.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.flagship.account_ledger.ledger.exception.SnapshotDecodeException;
import com.flagship.account_ledger.ledger.exception.SnapshotIOException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Snapshot store backed by a single JSON file.
 *
 * Writes go to a temporary file in the same directory which is then moved
 * over the target, so a reader sees either the previous document or the new
 * one, never a partial write. Writes are serialized by a lock.
 */
@Slf4j
public class JsonFileSnapshotStore implements SnapshotStore {

    @Getter
    private final Path path;
    private final ObjectMapper objectMapper;
    private final boolean prettyPrint;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonFileSnapshotStore(Path path, ObjectMapper objectMapper, boolean prettyPrint) {
        this.path = path.toAbsolutePath();
        this.objectMapper = objectMapper;
        this.prettyPrint = prettyPrint;
    }

    @Override
    public void save(LedgerState state) {
        LedgerSnapshot document = SnapshotMapper.toSnapshot(state);
        ObjectWriter writer = prettyPrint ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();

        writeLock.lock();
        try {
            Path directory = path.getParent();
            Files.createDirectories(directory);
            Path temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            try {
                writer.writeValue(temp.toFile(), document);
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("Saved {} accounts to {}", document.accountsOrEmpty().size(), path);
        } catch (IOException e) {
            log.error("Failed to save snapshot to {}: {}", path, e.getMessage());
            throw new SnapshotIOException("Failed to write snapshot to " + path, e);
        } finally {
            writeLock.unlock();
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public LedgerState load() {
        if (!Files.exists(path)) {
            log.info("No existing snapshot found at {}", path);
            return LedgerState.empty();
        }

        LedgerSnapshot document;
        try {
            document = objectMapper.readValue(path.toFile(), LedgerSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotDecodeException("Invalid JSON in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new SnapshotIOException("Failed to read snapshot from " + path, e);
        }

        LedgerState state = SnapshotMapper.toState(document);
        log.info("Loaded {} accounts from {}", state.getAccounts().size(), path);
        return state;
    }

    @Override
    public boolean exists() {
        return Files.exists(path);
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            if (Files.deleteIfExists(path)) {
                log.info("Deleted snapshot {}", path);
            }
        } catch (IOException e) {
            throw new SnapshotIOException("Failed to delete snapshot " + path, e);
        } finally {
            writeLock.unlock();
        }
    }
}
