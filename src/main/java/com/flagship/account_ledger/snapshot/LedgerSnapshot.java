package com.flagship.account_ledger.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the persisted snapshot document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LedgerSnapshot {

    @JsonProperty("accounts")
    private LinkedHashMap<String, AccountSnapshot> accounts;

    @JsonProperty("_account_counter")
    private Long accountCounter;

    public Map<String, AccountSnapshot> accountsOrEmpty() {
        return accounts == null ? Map.of() : accounts;
    }
}
