package com.flagship.loyalty_ledger.enrollment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "approval_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApprovalRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "enrollment_id", nullable = false, updatable = false)
    private UUID enrollmentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ApprovalStatus status;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private Instant requestedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "responded_at")
    private Instant respondedAt;

    static ApprovalRequestEntity fromDomain(ApprovalRequest request) {
        return new ApprovalRequestEntity(
            request.getId(),
            request.getEnrollmentId(),
            request.getStatus(),
            request.getRequestedAt(),
            request.getExpiresAt(),
            request.getRespondedAt()
        );
    }

    public ApprovalRequest toDomain() {
        return new ApprovalRequest(id, enrollmentId, status, requestedAt, expiresAt, respondedAt);
    }

    void updateFromDomain(ApprovalRequest request) {
        this.status = request.getStatus();
        this.respondedAt = request.getRespondedAt();
    }
}
