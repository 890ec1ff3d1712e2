package com.flagship.account_ledger.config;

import com.flagship.account_ledger.ledger.Account;
import com.flagship.account_ledger.snapshot.CorruptSnapshotPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized ledger settings, bound from the {@code ledger.*} keys.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Snapshot snapshot = new Snapshot();
    private Statement statement = new Statement();
    private Demo demo = new Demo();

    @Getter
    @Setter
    public static class Snapshot {
        /**
         * Location of the JSON snapshot file.
         */
        private String path = "accounts.json";

        /**
         * Start-up behavior when the snapshot cannot be decoded.
         */
        private CorruptSnapshotPolicy onCorrupt = CorruptSnapshotPolicy.EMPTY;

        private boolean prettyPrint = true;
    }

    @Getter
    @Setter
    public static class Statement {
        /**
         * Number of recent transactions shown on a statement.
         */
        private int size = Account.DEFAULT_STATEMENT_SIZE;
    }

    @Getter
    @Setter
    public static class Demo {
        /**
         * Runs the sample walkthrough at start-up.
         */
        private boolean enabled = false;
    }
}
