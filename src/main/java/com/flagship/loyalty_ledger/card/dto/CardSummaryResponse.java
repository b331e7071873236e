package com.flagship.loyalty_ledger.card.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.ledger.LedgerSummary;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class CardSummaryResponse {

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("total_earned")
    long totalEarned;

    @JsonProperty("total_redeemed")
    long totalRedeemed;

    @JsonProperty("total_deducted")
    long totalDeducted;

    @JsonProperty("transaction_count")
    long transactionCount;

    @JsonProperty("consistent")
    boolean consistent;

    public static CardSummaryResponse from(LedgerSummary summary) {
        return CardSummaryResponse.builder()
            .cardId(summary.getCardId())
            .balance(summary.getBalance())
            .totalEarned(summary.getTotalEarned())
            .totalRedeemed(summary.getTotalRedeemed())
            .totalDeducted(summary.getTotalDeducted())
            .transactionCount(summary.getTransactionCount())
            .consistent(summary.isConsistent())
            .build();
    }
}
