package com.flagship.account_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only aggregate view over the ledger.
 */
@Value
@Builder
public class LedgerStats {
    int totalAccounts;
    int activeAccounts;
    int inactiveAccounts;
    long transactionCount;
    BigDecimal activeBalance;
    BigDecimal inactiveBalance;
}
