package com.flagship.credit_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.credit_ledger.wallet.AccountBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class WalletBalanceResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("balances")
    List<Balance> balances;

    @Value
    public static class Balance {

        @JsonProperty("asset_type_code")
        String assetTypeCode;

        @JsonProperty("account_id")
        String accountId;

        @JsonFormat(shape = JsonFormat.Shape.STRING)
        @JsonProperty("balance")
        BigDecimal balance;
    }

    public static WalletBalanceResponse from(String userId, List<AccountBalance> balances) {
        return WalletBalanceResponse.builder()
            .userId(userId)
            .balances(balances.stream()
                .map(b -> new Balance(b.getAssetTypeCode(), b.getAccountId(), b.getBalance()))
                .toList())
            .build();
    }
}
