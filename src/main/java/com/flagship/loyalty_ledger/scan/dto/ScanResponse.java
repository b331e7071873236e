package com.flagship.loyalty_ledger.scan.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.scan.ScanOutcome;
import com.flagship.loyalty_ledger.scan.ScanResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanResponse {

    @JsonProperty("outcome")
    ScanOutcome outcome;

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("new_balance")
    Long newBalance;

    @JsonProperty("replayed")
    boolean replayed;

    @JsonProperty("enrollment_id")
    UUID enrollmentId;

    @JsonProperty("approval_request_id")
    UUID approvalRequestId;

    public static ScanResponse from(ScanResult result) {
        return ScanResponse.builder()
            .outcome(result.getOutcome())
            .cardId(result.getCardId())
            .transactionId(result.getTransactionId())
            .newBalance(result.getNewBalance())
            .replayed(result.isReplayed())
            .enrollmentId(result.getEnrollmentId())
            .approvalRequestId(result.getApprovalRequestId())
            .build();
    }
}
