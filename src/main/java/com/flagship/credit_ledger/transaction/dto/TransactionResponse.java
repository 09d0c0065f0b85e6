package com.flagship.credit_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.transaction.Transaction;
import com.flagship.credit_ledger.transaction.TransactionStatus;
import com.flagship.credit_ledger.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("transaction_type")
    TransactionType transactionType;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("asset_type_code")
    String assetTypeCode;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("debit_account_id")
    String debitAccountId;

    @JsonProperty("credit_account_id")
    String creditAccountId;

    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @JsonProperty("description")
    String description;

    @JsonProperty("metadata")
    Map<String, Object> metadata;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .transactionType(transaction.getType())
            .status(transaction.getStatus())
            .userId(transaction.getUserId())
            .assetTypeCode(transaction.getAssetTypeCode())
            .amount(transaction.getAmount())
            .debitAccountId(transaction.getDebitAccountId())
            .creditAccountId(transaction.getCreditAccountId())
            .idempotencyKey(transaction.getIdempotencyKey())
            .description(transaction.getDescription())
            .metadata(transaction.getMetadata())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
