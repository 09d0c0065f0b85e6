package com.flagship.credit_ledger.exception;

/**
 * Transient contention: lock wait or commit exceeded the timeout, or the store
 * reported a retryable concurrency failure. The unit of work was rolled back in full.
 */
public class LedgerConflictException extends LedgerException {

    public LedgerConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public String getOutcome() {
        return "conflict";
    }
}
