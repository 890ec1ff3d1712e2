package com.flagship.account_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.account_ledger.snapshot.JsonFileSnapshotStore;
import com.flagship.account_ledger.snapshot.SnapshotStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the snapshot store from {@link LedgerProperties}.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    @Bean
    public SnapshotStore snapshotStore(LedgerProperties properties, ObjectMapper objectMapper) {
        LedgerProperties.Snapshot snapshot = properties.getSnapshot();
        return new JsonFileSnapshotStore(Path.of(snapshot.getPath()), objectMapper, snapshot.isPrettyPrint());
    }
}
