package com.flagship.credit_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.ledger.Account;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("account_type")
    Account.Kind kind;

    @JsonProperty("asset_type_code")
    String assetTypeCode;

    @JsonProperty("version")
    long version;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .userId(account.getUserId())
            .kind(account.getKind())
            .assetTypeCode(account.getAssetTypeCode())
            .version(account.getVersion())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
