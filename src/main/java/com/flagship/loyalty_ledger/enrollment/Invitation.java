package com.flagship.loyalty_ledger.enrollment;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Result of {@link EnrollmentWorkflow#invite}.
 */
@Value
public class Invitation {
    UUID enrollmentId;
    UUID approvalRequestId;
    String customerId;
    String programId;
    String businessId;
    EnrollmentStatus status;
    Instant expiresAt;
}
