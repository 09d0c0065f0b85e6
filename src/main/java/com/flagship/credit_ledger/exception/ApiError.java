package com.flagship.credit_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    boolean retryable;
    Instant timestamp;

    @JsonProperty("correlation_id")
    String correlationId;
}
