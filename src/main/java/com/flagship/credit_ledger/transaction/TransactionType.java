package com.flagship.credit_ledger.transaction;

import com.flagship.credit_ledger.exception.LedgerValidationException;

import java.util.Locale;

/**
 * Kinds of credit movement.
 *
 * TOPUP and BONUS move credits from the treasury to the user; SPEND moves them back.
 * REFUND and ADJUSTMENT are reserved names and are not accepted by the engine.
 */
public enum TransactionType {
    TOPUP(true, true, "Wallet top-up for %s"),
    BONUS(true, true, "Bonus credit for %s"),
    SPEND(true, false, "Purchase by %s"),
    REFUND(false, false, "Refund for %s"),
    ADJUSTMENT(false, false, "Adjustment for %s");

    private final boolean supported;
    private final boolean userReceives;
    private final String descriptionFormat;

    TransactionType(boolean supported, boolean userReceives, String descriptionFormat) {
        this.supported = supported;
        this.userReceives = userReceives;
        this.descriptionFormat = descriptionFormat;
    }

    public boolean isSupported() {
        return supported;
    }

    /**
     * True when the user's account is the debit side (its balance grows).
     */
    public boolean isUserReceiving() {
        return userReceives;
    }

    /**
     * SPEND is the only type authorized against the user's balance.
     */
    public boolean requiresFunds() {
        return supported && !userReceives;
    }

    public String describe(String userId) {
        return String.format(descriptionFormat, userId);
    }

    /**
     * Parses a type name from a URL segment or request body, case-insensitively.
     *
     * @throws LedgerValidationException if the name is blank or unknown
     */
    public static TransactionType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new LedgerValidationException("Transaction type is required");
        }
        try {
            return TransactionType.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new LedgerValidationException("Unknown transaction type: " + name);
        }
    }
}
