package com.flagship.loyalty_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.ledger.LedgerResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class LedgerResultResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("new_balance")
    long newBalance;

    @JsonProperty("card_version")
    long cardVersion;

    @JsonProperty("replayed")
    boolean replayed;

    public static LedgerResultResponse from(LedgerResult result) {
        return LedgerResultResponse.builder()
            .transactionId(result.getTransactionId())
            .cardId(result.getCardId())
            .newBalance(result.getNewBalance())
            .cardVersion(result.getCardVersion())
            .replayed(result.isReplayed())
            .build();
    }
}
