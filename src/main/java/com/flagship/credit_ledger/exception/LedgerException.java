package com.flagship.credit_ledger.exception;

/**
 * Base type for every failure the ledger reports to its callers.
 *
 * Subclasses tell the caller whether retrying the same request
 * (with the same idempotency key) can succeed.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }

    /**
     * Short, low-cardinality label used for metrics tags.
     */
    public abstract String getOutcome();
}
