package com.flagship.loyalty_ledger.enrollment;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * The customer's pending yes/no decision on an invitation. Only a PENDING
 * request can be answered or expired, and only once.
 */
@Value
public class ApprovalRequest {
    UUID id;
    UUID enrollmentId;
    ApprovalStatus status;
    Instant requestedAt;
    Instant expiresAt;
    Instant respondedAt;

    public static ApprovalRequest issue(UUID enrollmentId, Instant now, Duration ttl) {
        return new ApprovalRequest(UUID.randomUUID(), enrollmentId, ApprovalStatus.PENDING,
            now, now.plus(ttl), null);
    }

    public boolean isPastDeadline(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public ApprovalRequest accept(Instant now) {
        return resolve(ApprovalStatus.ACCEPTED, now);
    }

    public ApprovalRequest decline(Instant now) {
        return resolve(ApprovalStatus.DECLINED, now);
    }

    public ApprovalRequest expire(Instant now) {
        return resolve(ApprovalStatus.EXPIRED, now);
    }

    private ApprovalRequest resolve(ApprovalStatus outcome, Instant now) {
        if (status != ApprovalStatus.PENDING) {
            throw new IllegalStateException(
                "Approval request " + id + " is already " + status);
        }
        return new ApprovalRequest(id, enrollmentId, outcome, requestedAt, expiresAt, now);
    }
}
