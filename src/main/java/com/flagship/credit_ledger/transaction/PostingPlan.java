package com.flagship.credit_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A validated request with both participant accounts resolved, ready to be posted.
 */
@Value
@Builder
public class PostingPlan {
    TransactionType type;
    String userId;
    String assetTypeCode;
    BigDecimal amount;
    String idempotencyKey;
    Map<String, Object> metadata;

    String userAccountId;
    String treasuryAccountId;

    public String getDebitAccountId() {
        return type.isUserReceiving() ? userAccountId : treasuryAccountId;
    }

    public String getCreditAccountId() {
        return type.isUserReceiving() ? treasuryAccountId : userAccountId;
    }
}
