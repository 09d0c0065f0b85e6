package com.flagship.credit_ledger.transaction;

import lombok.Value;

/**
 * Outcome of {@link TransactionEngine#process}: the transaction, and whether it
 * was written by an earlier request carrying the same idempotency key.
 */
@Value
public class TransactionResult {
    Transaction transaction;
    boolean replayed;

    public static TransactionResult created(Transaction transaction) {
        return new TransactionResult(transaction, false);
    }

    public static TransactionResult replayed(Transaction transaction) {
        return new TransactionResult(transaction, true);
    }
}
