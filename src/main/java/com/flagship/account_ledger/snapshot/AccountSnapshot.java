package com.flagship.account_ledger.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Persisted form of an account, including its full transaction log.
 *
 * isActive and transactionCounter are boxed so that documents written
 * without them can still be read; see {@link SnapshotMapper} for the defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"account_id", "owner", "balance", "is_active", "transactions", "created_at", "_transaction_counter"})
public class AccountSnapshot {

    @JsonProperty("account_id")
    private String accountId;

    @JsonProperty("owner")
    private String owner;

    @JsonProperty("balance")
    private BigDecimal balance;

    @JsonProperty("is_active")
    private Boolean isActive;

    @JsonProperty("transactions")
    private List<TransactionSnapshot> transactions;

    @JsonProperty("created_at")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant createdAt;

    @JsonProperty("_transaction_counter")
    private Long transactionCounter;
}
