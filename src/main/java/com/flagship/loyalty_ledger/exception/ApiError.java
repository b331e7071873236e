package com.flagship.loyalty_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned for every rejected request.
 *
 * {@code code} is stable and safe to branch on; {@code message} is for people.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    @JsonProperty("error")
    String error;

    @JsonProperty("code")
    String code;

    @JsonProperty("category")
    ErrorCategory category;

    @JsonProperty("message")
    String message;

    @JsonProperty("details")
    Map<String, String> details;

    @JsonProperty("correlation_id")
    String correlationId;

    @JsonProperty("timestamp")
    Instant timestamp;
}
