package com.flagship.credit_ledger.exception;

/**
 * Malformed or out-of-range input. Raised before any lock is taken; nothing was written.
 */
public class LedgerValidationException extends LedgerException {

    public LedgerValidationException(String message) {
        super(message);
    }

    @Override
    public String getOutcome() {
        return "validation_error";
    }
}
