package com.flagship.account_ledger.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persisted form of a transaction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransactionSnapshot {

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private String type;

    @JsonProperty("amount")
    private BigDecimal amount;

    @JsonProperty("balance_after")
    private BigDecimal balanceAfter;

    @JsonProperty("timestamp")
    @JsonDeserialize(using = LenientInstantDeserializer.class)
    private Instant timestamp;

    @JsonProperty("description")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String description;
}
