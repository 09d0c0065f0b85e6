package com.flagship.credit_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.EntryType;
import com.flagship.credit_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("transaction_id")
    String transactionId;

    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("counterparty_account_id")
    String counterpartyAccountId;

    @JsonProperty("asset_type_code")
    String assetTypeCode;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .transactionId(entry.getTransactionId())
            .entryType(entry.getEntryType())
            .accountId(entry.getAccountId())
            .counterpartyAccountId(entry.getCounterpartyAccountId())
            .assetTypeCode(entry.getAssetTypeCode())
            .amount(entry.getAmount())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
