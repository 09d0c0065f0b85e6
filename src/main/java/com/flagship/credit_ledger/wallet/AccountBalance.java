package com.flagship.credit_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Derived balance of one account at the time it was read.
 */
@Value
public class AccountBalance {
    String assetTypeCode;
    String accountId;
    BigDecimal balance;
}
