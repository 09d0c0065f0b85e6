package com.flagship.credit_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One leg of a balanced pair. Immutable once written.
 *
 * Each transaction has exactly two legs: a DEBIT posted to the debit account with the
 * credit account as counterparty, and a CREDIT posted to the credit account with the
 * debit account as counterparty.
 */
@Value
public class LedgerEntry {

    /**
     * Scale of every amount column in the journal.
     */
    public static final int AMOUNT_SCALE = 2;

    String id;
    String transactionId;
    EntryType entryType;
    String accountId;
    String counterpartyAccountId;
    String assetTypeCode;
    BigDecimal amount;
    Instant createdAt;
}
