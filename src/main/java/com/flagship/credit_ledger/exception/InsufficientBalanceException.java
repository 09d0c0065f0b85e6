package com.flagship.credit_ledger.exception;

import java.math.BigDecimal;

/**
 * A SPEND exceeded the balance read under lock. Nothing was written.
 */
public class InsufficientBalanceException extends LedgerException {

    private final String userId;
    private final String assetTypeCode;
    private final BigDecimal currentBalance;
    private final BigDecimal requiredAmount;

    public InsufficientBalanceException(String userId, String assetTypeCode,
                                        BigDecimal currentBalance, BigDecimal requiredAmount) {
        super(String.format("Insufficient %s balance for user %s (current: %s, required: %s)",
            assetTypeCode, userId, currentBalance.toPlainString(), requiredAmount.toPlainString()));
        this.userId = userId;
        this.assetTypeCode = assetTypeCode;
        this.currentBalance = currentBalance;
        this.requiredAmount = requiredAmount;
    }

    public String getUserId() {
        return userId;
    }

    public String getAssetTypeCode() {
        return assetTypeCode;
    }

    public BigDecimal getCurrentBalance() {
        return currentBalance;
    }

    public BigDecimal getRequiredAmount() {
        return requiredAmount;
    }

    @Override
    public String getOutcome() {
        return "insufficient_balance";
    }
}
