package com.flagship.account_ledger.ledger;

/**
 * Kind of balance-affecting event recorded on an account.
 */
public enum TransactionType {
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal");

    private final String operation;

    TransactionType(String operation) {
        this.operation = operation;
    }

    /**
     * Lower-case operation name used in messages.
     */
    public String getOperation() {
        return operation;
    }
}
