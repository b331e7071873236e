package com.flagship.loyalty_ledger.enrollment;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Enrollment of a customer in a business's loyalty program.
 *
 * Key principles:
 * - Status is the only record of enrollment state
 * - Transitions are explicit and validated; invalid ones throw IllegalStateException
 * - Transitions return a new instance
 */
@Value
public class Enrollment {
    UUID id;
    String customerId;
    String programId;
    String businessId;
    String originKey;
    EnrollmentStatus status;
    Instant createdAt;
    Instant updatedAt;
    Instant activatedAt;
    Instant endedAt;
    String endReason;

    public static Enrollment invite(String customerId, String programId, String businessId, Instant now) {
        return invite(customerId, programId, businessId, null, now);
    }

    /**
     * @param originKey Key of the request that created the invitation, such as
     *                  a scan id, or null. Unique across enrollments.
     */
    public static Enrollment invite(String customerId, String programId, String businessId,
                                    String originKey, Instant now) {
        return new Enrollment(
            UUID.randomUUID(),
            customerId,
            programId,
            businessId,
            originKey,
            EnrollmentStatus.INVITED,
            now,
            now,
            null,
            null,
            null
        );
    }

    /**
     * INVITED -> PENDING_APPROVAL, once the approval request has been issued.
     */
    public Enrollment awaitApproval(Instant now) {
        requireStatus(EnrollmentStatus.INVITED, "await approval");
        return withStatus(EnrollmentStatus.PENDING_APPROVAL, now, activatedAt, endedAt, endReason);
    }

    public Enrollment activate(Instant now) {
        requireStatus(EnrollmentStatus.PENDING_APPROVAL, "activate");
        return withStatus(EnrollmentStatus.ACTIVE, now, now, null, null);
    }

    public Enrollment decline(Instant now, String reason) {
        requireStatus(EnrollmentStatus.PENDING_APPROVAL, "decline");
        return withStatus(EnrollmentStatus.DECLINED, now, null, now, reason);
    }

    public Enrollment revoke(Instant now, String reason) {
        requireStatus(EnrollmentStatus.ACTIVE, "revoke");
        return withStatus(EnrollmentStatus.REVOKED, now, activatedAt, now, reason);
    }

    private void requireStatus(EnrollmentStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException(
                String.format("Cannot %s enrollment %s in %s status. Only %s enrollments allow it.",
                    action, id, status, expected));
        }
    }

    private Enrollment withStatus(EnrollmentStatus newStatus, Instant now, Instant activated,
                                  Instant ended, String reason) {
        return new Enrollment(id, customerId, programId, businessId, originKey, newStatus,
            createdAt, now, activated, ended, reason);
    }
}
