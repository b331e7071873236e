package com.flagship.loyalty_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.ledger.TransactionSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * Request DTO for awarding, redeeming or adjusting points.
 */
@Value
public class ApplyDeltaRequest {

    @NotNull(message = "Card ID is required")
    @JsonProperty("card_id")
    UUID cardId;

    @NotNull(message = "Delta is required")
    @JsonProperty("delta")
    Long delta;

    @NotNull(message = "Source is required")
    @JsonProperty("source")
    TransactionSource source;

    @NotBlank(message = "Idempotency key is required")
    @Size(max = 255, message = "Idempotency key must be at most 255 characters")
    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    String description;
}
