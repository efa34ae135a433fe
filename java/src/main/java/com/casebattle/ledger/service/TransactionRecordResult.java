package com.casebattle.ledger.service;

import com.casebattle.ledger.domain.LedgerTransaction;

import java.math.BigDecimal;

/**
 * An appended transaction together with the user's balance as of that commit.
 */
public class TransactionRecordResult {

    private final LedgerTransaction transaction;
    private final BigDecimal balance;

    public TransactionRecordResult(LedgerTransaction transaction, BigDecimal balance) {
        this.transaction = transaction;
        this.balance = balance;
    }

    public LedgerTransaction getTransaction() {
        return transaction;
    }

    public BigDecimal getBalance() {
        return balance;
    }
}
