package com.flagship.loyalty_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.ledger.PointTransaction;
import com.flagship.loyalty_ledger.ledger.TransactionSource;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("delta")
    long delta;

    @JsonProperty("source")
    TransactionSource source;

    @JsonProperty("balance_after")
    long balanceAfter;

    @JsonProperty("description")
    String description;

    @JsonProperty("reverses_transaction_id")
    UUID reversesTransactionId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(PointTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .cardId(transaction.getCardId())
            .delta(transaction.getDelta())
            .source(transaction.getSource())
            .balanceAfter(transaction.getBalanceAfter())
            .description(transaction.getDescription())
            .reversesTransactionId(transaction.getReversesTransactionId())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
