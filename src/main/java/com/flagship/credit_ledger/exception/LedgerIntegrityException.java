package com.flagship.credit_ledger.exception;

/**
 * A constraint violation or missing row that does not match any recoverable pattern.
 * Fatal for the request; the unit of work was rolled back.
 */
public class LedgerIntegrityException extends LedgerException {

    public LedgerIntegrityException(String message) {
        super(message);
    }

    public LedgerIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getOutcome() {
        return "integrity_error";
    }
}
