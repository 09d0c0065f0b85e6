package com.flagship.credit_ledger.asset;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * A kind of virtual credit (e.g. GOLD_COINS).
 * Everything except {@code active} is fixed once registered.
 */
@Value
public class AssetType {

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;
}
