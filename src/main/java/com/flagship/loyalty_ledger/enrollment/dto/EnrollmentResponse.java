package com.flagship.loyalty_ledger.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.enrollment.Enrollment;
import com.flagship.loyalty_ledger.enrollment.EnrollmentStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EnrollmentResponse {

    @JsonProperty("enrollment_id")
    UUID enrollmentId;

    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("program_id")
    String programId;

    @JsonProperty("business_id")
    String businessId;

    @JsonProperty("status")
    EnrollmentStatus status;

    @JsonProperty("card_id")
    UUID cardId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("activated_at")
    Instant activatedAt;

    @JsonProperty("ended_at")
    Instant endedAt;

    @JsonProperty("end_reason")
    String endReason;

    public static EnrollmentResponse from(Enrollment enrollment, UUID cardId) {
        return EnrollmentResponse.builder()
            .enrollmentId(enrollment.getId())
            .customerId(enrollment.getCustomerId())
            .programId(enrollment.getProgramId())
            .businessId(enrollment.getBusinessId())
            .status(enrollment.getStatus())
            .cardId(cardId)
            .createdAt(enrollment.getCreatedAt())
            .activatedAt(enrollment.getActivatedAt())
            .endedAt(enrollment.getEndedAt())
            .endReason(enrollment.getEndReason())
            .build();
    }
}
