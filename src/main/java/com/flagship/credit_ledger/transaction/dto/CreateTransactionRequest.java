package com.flagship.credit_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Request body for creating a transaction.
 *
 * The amount travels as a decimal string ("100.00") so no precision is lost in JSON.
 * {@code type} is only read by the generic endpoint; the typed endpoints take it from the path.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateTransactionRequest {

    @JsonProperty("type")
    private String type;

    @NotBlank(message = "User id is required")
    @Size(max = 100, message = "User id must be at most 100 characters")
    @JsonProperty("user_id")
    private String userId;

    @NotBlank(message = "Asset type is required")
    @JsonProperty("asset_type")
    private String assetType;

    @NotBlank(message = "Amount is required")
    @Pattern(regexp = "^\\d{1,18}(\\.\\d+)?$", message = "Amount must be a positive decimal string such as \"100.00\"")
    @JsonProperty("amount")
    private String amount;

    @NotBlank(message = "Idempotency key is required")
    @Size(max = 255, message = "Idempotency key must be at most 255 characters")
    @JsonProperty("idempotency_key")
    private String idempotencyKey;

    @JsonProperty("metadata")
    private Map<String, Object> metadata;

    public BigDecimal amountValue() {
        return new BigDecimal(amount);
    }
}
