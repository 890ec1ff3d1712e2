package com.flagship.account_ledger.ledger;

import lombok.Value;

/**
 * Both legs of a completed transfer, withdrawal first.
 */
@Value
public class TransferResult {
    Transaction withdrawal;
    Transaction deposit;
}
