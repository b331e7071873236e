package com.flagship.loyalty_ledger.enrollment;

import lombok.Value;

import java.util.UUID;

/**
 * Result of answering an approval request. {@code cardId} is set only when
 * the enrollment became ACTIVE.
 */
@Value
public class EnrollmentDecision {
    UUID enrollmentId;
    UUID approvalRequestId;
    EnrollmentStatus status;
    UUID cardId;
}
