package com.flagship.account_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one balance-affecting event on an account.
 *
 * Key invariants:
 * - amount is always positive
 * - balanceAfter is the owning account's balance right after this event and is never edited
 */
@Value
public class Transaction {
    String id;
    TransactionType type;
    BigDecimal amount;
    BigDecimal balanceAfter;
    Instant timestamp;
    String description;

    public Transaction(String id, TransactionType type, BigDecimal amount, BigDecimal balanceAfter,
                       Instant timestamp, String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.amount = Money.requirePositive(amount, type.getOperation());
        this.balanceAfter = Objects.requireNonNull(balanceAfter, "balanceAfter");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.description = description;
    }

    /**
     * Creates a transaction stamped with the current time.
     */
    public static Transaction create(String id, TransactionType type, BigDecimal amount,
                                     BigDecimal balanceAfter, String description) {
        return new Transaction(id, type, amount, balanceAfter, Instant.now(), description);
    }

    public Optional<String> findDescription() {
        return Optional.ofNullable(description);
    }

    public boolean isDeposit() {
        return type == TransactionType.DEPOSIT;
    }
}
