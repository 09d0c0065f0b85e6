package com.flagship.credit_ledger.exception;

public class TransactionNotFoundException extends LedgerException {

    private final String transactionId;

    public TransactionNotFoundException(String transactionId) {
        super("Transaction not found: " + transactionId);
        this.transactionId = transactionId;
    }

    public String getTransactionId() {
        return transactionId;
    }

    @Override
    public String getOutcome() {
        return "not_found";
    }
}
