package com.flagship.loyalty_ledger.card.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.card.CardStatus;
import com.flagship.loyalty_ledger.card.CardTier;
import com.flagship.loyalty_ledger.card.LoyaltyCard;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Card snapshot. {@code version} increases with every balance change and lets
 * a dashboard discard anything older than what it already shows.
 */
@Value
@Builder
public class CardResponse {

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("enrollment_id")
    UUID enrollmentId;

    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("program_id")
    String programId;

    @JsonProperty("business_id")
    String businessId;

    @JsonProperty("card_number")
    String cardNumber;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("tier")
    CardTier tier;

    @JsonProperty("status")
    CardStatus status;

    @JsonProperty("version")
    long version;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static CardResponse from(LoyaltyCard card) {
        return CardResponse.builder()
            .cardId(card.getId())
            .enrollmentId(card.getEnrollmentId())
            .customerId(card.getCustomerId())
            .programId(card.getProgramId())
            .businessId(card.getBusinessId())
            .cardNumber(card.getCardNumber())
            .balance(card.getBalance())
            .tier(card.getTier())
            .status(card.getStatus())
            .version(card.getVersion())
            .createdAt(card.getCreatedAt())
            .updatedAt(card.getUpdatedAt())
            .build();
    }
}
