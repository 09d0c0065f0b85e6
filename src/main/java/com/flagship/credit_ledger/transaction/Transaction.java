package com.flagship.credit_ledger.transaction;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Transaction domain object. Immutable once written.
 *
 * Metadata is an opaque caller payload: stored and returned as given, never interpreted.
 */
@Value
@Builder
public class Transaction {
    String id;
    TransactionType type;
    TransactionStatus status;
    String userId;
    String assetTypeCode;
    BigDecimal amount;
    String debitAccountId;
    String creditAccountId;
    String idempotencyKey;
    String description;
    Map<String, Object> metadata;
    Instant createdAt;
}
