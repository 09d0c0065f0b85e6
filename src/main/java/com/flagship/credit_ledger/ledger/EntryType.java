package com.flagship.credit_ledger.ledger;

/**
 * Side of a ledger leg. A DEBIT leg raises the balance of the account it posts to,
 * a CREDIT leg lowers it.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
