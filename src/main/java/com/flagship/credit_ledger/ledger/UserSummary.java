package com.flagship.credit_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class UserSummary {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("account_count")
    long accountCount;
}
