package com.flagship.loyalty_ledger.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.enrollment.EnrollmentDecision;
import com.flagship.loyalty_ledger.enrollment.EnrollmentStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class DecisionResponse {

    @JsonProperty("enrollment_id")
    UUID enrollmentId;

    @JsonProperty("approval_request_id")
    UUID approvalRequestId;

    @JsonProperty("status")
    EnrollmentStatus status;

    @JsonProperty("card_id")
    UUID cardId;

    public static DecisionResponse from(EnrollmentDecision decision) {
        return DecisionResponse.builder()
            .enrollmentId(decision.getEnrollmentId())
            .approvalRequestId(decision.getApprovalRequestId())
            .status(decision.getStatus())
            .cardId(decision.getCardId())
            .build();
    }
}
