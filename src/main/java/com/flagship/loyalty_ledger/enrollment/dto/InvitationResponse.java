package com.flagship.loyalty_ledger.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.enrollment.EnrollmentStatus;
import com.flagship.loyalty_ledger.enrollment.Invitation;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class InvitationResponse {

    @JsonProperty("enrollment_id")
    UUID enrollmentId;

    @JsonProperty("approval_request_id")
    UUID approvalRequestId;

    @JsonProperty("customer_id")
    String customerId;

    @JsonProperty("program_id")
    String programId;

    @JsonProperty("business_id")
    String businessId;

    @JsonProperty("status")
    EnrollmentStatus status;

    @JsonProperty("expires_at")
    Instant expiresAt;

    public static InvitationResponse from(Invitation invitation) {
        return InvitationResponse.builder()
            .enrollmentId(invitation.getEnrollmentId())
            .approvalRequestId(invitation.getApprovalRequestId())
            .customerId(invitation.getCustomerId())
            .programId(invitation.getProgramId())
            .businessId(invitation.getBusinessId())
            .status(invitation.getStatus())
            .expiresAt(invitation.getExpiresAt())
            .build();
    }
}
