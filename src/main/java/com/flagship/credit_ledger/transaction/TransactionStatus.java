package com.flagship.credit_ledger.transaction;

/**
 * Transaction lifecycle. The engine writes COMPLETED directly; a rejected request leaves no row.
 */
public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED
}
